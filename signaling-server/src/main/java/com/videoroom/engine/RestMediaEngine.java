package com.videoroom.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.videoroom.config.MediaEngineProperties;
import com.videoroom.global.concurrent.Mailbox;
import com.videoroom.model.EngineCommand;
import com.videoroom.model.EngineEvent;
import com.videoroom.model.RoomId;
import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriUtils;

/**
 * 외부 SFU 서버와 HTTP로 통신하는 엔진 바인딩.
 * 명령은 전용 mailbox에서 보낸 순서대로 호출되고, 실패하면 COMMAND_REJECTED 이벤트로 돌아온다.
 * SFU가 보내는 이벤트는 내부 API를 거쳐 {@link #publish(EngineEvent)}로 들어온다.
 */
public class RestMediaEngine extends AbstractMediaEngine {

    private static final Logger log = LoggerFactory.getLogger(RestMediaEngine.class);

    private final RestTemplate restTemplate;
    private final MediaEngineProperties properties;
    private final Mailbox commands;
    private final Consumer<RestMediaEngine> closeListener;
    private final String roomPath;
    private final CompletableFuture<Void> drained = new CompletableFuture<>();

    public RestMediaEngine(RoomId roomId, RestTemplate restTemplate, MediaEngineProperties properties,
            Executor executor, Consumer<RestMediaEngine> closeListener) {
        super(roomId);
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.commands = new Mailbox("sfu-" + roomId, executor);
        this.closeListener = closeListener;
        this.roomPath = "/rooms/" + encode(roomId.getValue());
    }

    /**
     * SFU 서버에 방(Router) 생성을 요청한다. 호출한 스레드에서 바로 실행된다.
     */
    void open() {
        log.debug("Requesting SFU room for {}", getRoomId());
        exchangeForJson(HttpMethod.POST, "/rooms", Map.of("roomId", getRoomId().getValue()));
    }

    @Override
    protected void dispatch(EngineCommand command) {
        commands.post(() -> send(command));
    }

    private void send(EngineCommand command) {
        try {
            switch (command.getKind()) {
                case ADD_PEER -> exchangeForJson(HttpMethod.POST, roomPath + "/peers",
                        Map.of("peerId", command.getPeerId().getValue()));
                case REMOVE_PEER -> exchangeForJson(HttpMethod.DELETE, peerPath(command), null);
                case MEDIA_EVENT -> exchangeForJson(HttpMethod.POST, peerPath(command) + "/media-events",
                        Collections.singletonMap("data", command.getPayload()));
                case SHUTDOWN -> {
                    exchangeForJson(HttpMethod.DELETE, roomPath, null);
                    publish(EngineEvent.shutdownAck());
                }
            }
        } catch (MediaEngineException ex) {
            publish(EngineEvent.commandRejected(command.getKind(), command.getPeerId(), ex.getMessage()));
        }
    }

    private String peerPath(EngineCommand command) {
        return roomPath + "/peers/" + encode(command.getPeerId().getValue());
    }

    /**
     * 닫힌 뒤, 이미 큐에 들어가 있던 SFU 호출까지 모두 끝나면 완료된다.
     */
    CompletableFuture<Void> whenDrained() {
        return drained;
    }

    @Override
    protected void onClose() {
        if (!commands.post(() -> drained.complete(null))) {
            drained.complete(null);
        }
        commands.close();
        closeListener.accept(this);
    }

	private JsonNode exchangeForJson(HttpMethod method, String path, Object body) {
		// 모든 SFU API 호출이 이 메서드를 통해 이루어진다.
		try {
			URI uri = URI.create(properties.getBaseUri() + path);
			log.debug("Calling SFU {} {} with body {}", method, uri, body);

			HttpHeaders headers = new HttpHeaders();
			headers.setContentType(MediaType.APPLICATION_JSON);

			HttpEntity<Object> entity = new HttpEntity<>(body, headers);
			ResponseEntity<JsonNode> response = restTemplate.exchange(uri, method, entity, JsonNode.class);

			log.debug("SFU response status {} body {}", response.getStatusCode(), response.getBody());
			return response.getBody();
		} catch (RestClientException ex) {
			log.error("SFU call failed for {} {}: {}", method, path, ex.getMessage(), ex);
			throw new MediaEngineException("Failed to call SFU at path " + path + ": " + ex.getMessage(), ex);
		}
	}

    private static String encode(String segment) {
        return UriUtils.encodePathSegment(segment, "UTF-8");
    }
}
