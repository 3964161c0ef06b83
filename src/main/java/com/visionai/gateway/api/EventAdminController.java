package com.visionai.gateway.api;

import com.visionai.gateway.core.channel.Channels;
import com.visionai.gateway.core.model.PublishResult;
import com.visionai.gateway.events.EventManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Operator endpoint for injecting events into the bus, e.g. to replay an agent request or trigger
 * {@code system.health-check}.
 *
 * Production posture: - Disabled by default. - Must sit behind network controls; the gateway itself does
 * no authentication. - The payload goes through the event manager, so it gets a fresh timestamp and eventId.
 *
 * Enable explicitly: agentgw.admin.enabled=true
 */
@RestController
@RequestMapping(path = "/admin/events", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "agentgw.admin", name = "enabled", havingValue = "true", matchIfMissing = false)
public class EventAdminController {

	private static final Logger log = LoggerFactory.getLogger(EventAdminController.class);

	private final EventManager eventManager;

	public EventAdminController(EventManager eventManager) {
		this.eventManager = eventManager;
	}

	/**
	 * Publishes the JSON object body on {@code channel}. 202 with the injected eventId on success,
	 * 503 when the bus rejected the publish.
	 */
	@PostMapping(path = "/{channel}", consumes = MediaType.APPLICATION_JSON_VALUE)
	public Mono<ResponseEntity<PublishResponse>> publish(@PathVariable String channel,
			@RequestBody(required = false) Map<String, Object> payload) {
		Channels.requireValid(channel);
		log.info("Admin publish requested channel={}", channel);
		return eventManager.publish(channel, payload == null ? Map.of() : payload)
				.map(result -> ResponseEntity
						.status(result.succeeded() ? HttpStatus.ACCEPTED : HttpStatus.SERVICE_UNAVAILABLE)
						.body(PublishResponse.of(result)));
	}

	public record PublishResponse(String channel, String eventId, boolean published, String error) {

		static PublishResponse of(PublishResult result) {
			return new PublishResponse(result.channel(), result.eventId(), result.succeeded(), result.error());
		}
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
		return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
	}

	record ApiError(String code, String message) {
	}
}
