package com.gnovoa.gridiron.out;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.gridiron.events.HistoryProgressEvent;
import com.gnovoa.gridiron.ws.WsRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@Component
public final class WebSocketEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEventPublisher.class);

    private final WsRouter router;
    private final ObjectMapper mapper;

    public WebSocketEventPublisher(WsRouter router, ObjectMapper mapper) {
        this.router = router;
        this.mapper = mapper;
    }

    @Override
    public void publish(HistoryProgressEvent event) {
        try {
            String json = mapper.writeValueAsString(event);
            TextMessage msg = new TextMessage(json);

            log.debug("Publishing progress of run {}: {}", event.runId(), json);

            for (WebSocketSession s : router.forKey(WsRouter.runKey(event.runId()))) {
                if (s.isOpen()) s.sendMessage(msg);
            }
        } catch (Exception e) {
            log.error("Failed to publish progress of run {}", event.runId(), e);
        }
    }
}
