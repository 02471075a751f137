package me.golemcore.agents.adapter.inbound.web.controller;

import me.golemcore.agents.adapter.inbound.web.dto.MessageRequest;
import me.golemcore.agents.adapter.inbound.web.dto.SessionRequest;
import me.golemcore.agents.domain.model.ChatSession;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.port.outbound.MessagePort;
import me.golemcore.agents.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionsControllerTest {

    private static final String SESSION_ID = "session-1";

    private SessionPort sessionPort;
    private MessagePort messagePort;
    private SessionsController controller;

    @BeforeEach
    void setUp() {
        sessionPort = mock(SessionPort.class);
        messagePort = mock(MessagePort.class);
        controller = new SessionsController(sessionPort, messagePort);
        when(sessionPort.get(SESSION_ID)).thenReturn(Optional.of(ChatSession.builder()
                .id(SESSION_ID)
                .agentId("agent-1")
                .title("Old")
                .contextConfig(Map.of("n", 5))
                .build()));
        when(sessionPort.get("missing")).thenReturn(Optional.empty());
        when(sessionPort.update(any(ChatSession.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(messagePort.append(any(Message.class))).thenAnswer(invocation -> {
            Message message = invocation.getArgument(0);
            message.setId("m-1");
            return message;
        });
    }

    @Test
    void shouldGetSession() {
        StepVerifier.create(controller.getSession(SESSION_ID))
                .assertNext(response -> assertEquals("Old", response.getBody().getTitle()))
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownSession() {
        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> controller.getSession("missing"));

        assertEquals(HttpStatus.NOT_FOUND, e.getStatusCode());
    }

    @Test
    void shouldKeepUnsetFieldsOnUpdate() {
        SessionRequest request = SessionRequest.builder().contextStrategy("summarize").build();

        StepVerifier.create(controller.updateSession(SESSION_ID, request))
                .assertNext(response -> {
                    assertEquals("Old", response.getBody().getTitle());
                    assertEquals("summarize", response.getBody().getContextStrategy());
                    assertEquals(5, response.getBody().getContextConfig().get("n"));
                })
                .verifyComplete();
    }

    @Test
    void shouldDeleteSession() {
        when(sessionPort.delete(SESSION_ID)).thenReturn(true);

        StepVerifier.create(controller.deleteSession(SESSION_ID))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();
        assertThrows(ResponseStatusException.class, () -> controller.deleteSession("missing"));
    }

    // ==================== Messages ====================

    @Test
    void shouldAppendMessage() {
        MessageRequest request = MessageRequest.builder()
                .role("user")
                .content("remember this")
                .metadata(Map.of("source", "import"))
                .build();

        StepVerifier.create(controller.createMessage(SESSION_ID, request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("m-1", response.getBody().getId());
                    assertEquals(SESSION_ID, response.getBody().getSessionId());
                    assertEquals("import", response.getBody().getMetadata().get("source"));
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectToolRoleAndBlankContent() {
        MessageRequest toolRole = MessageRequest.builder().role("tool").content("x").build();
        MessageRequest blank = MessageRequest.builder().role("user").content(" ").build();

        ResponseStatusException roleError = assertThrows(ResponseStatusException.class,
                () -> controller.createMessage(SESSION_ID, toolRole));
        ResponseStatusException contentError = assertThrows(ResponseStatusException.class,
                () -> controller.createMessage(SESSION_ID, blank));

        assertEquals(HttpStatus.BAD_REQUEST, roleError.getStatusCode());
        assertEquals("content is required", contentError.getReason());
        verify(messagePort, never()).append(any(Message.class));
    }

    @Test
    void shouldPageMessages() {
        when(messagePort.list(SESSION_ID, 2, 2)).thenReturn(List.of(
                Message.builder().id("m3").build(), Message.builder().id("m4").build()));
        when(messagePort.count(SESSION_ID)).thenReturn(5);

        StepVerifier.create(controller.listMessages(SESSION_ID, 2, 2))
                .assertNext(response -> {
                    assertEquals(2, response.getBody().getMessages().size());
                    assertEquals(5, response.getBody().getTotalCount());
                    assertTrue(response.getBody().isHasMore());
                })
                .verifyComplete();
    }

    @Test
    void shouldClearMessages() {
        when(messagePort.deleteBySession(SESSION_ID)).thenReturn(3);

        StepVerifier.create(controller.deleteMessages(SESSION_ID))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();
        verify(messagePort).deleteBySession(SESSION_ID);
    }
}
