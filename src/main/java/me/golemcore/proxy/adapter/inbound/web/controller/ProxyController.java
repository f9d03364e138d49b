package me.golemcore.proxy.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.proxy.domain.model.AssembledResponse;
import me.golemcore.proxy.domain.service.ProxyService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;

/**
 * Chat-completions endpoints used by the roleplay client. The {@code /quiet/}
 * variants suppress the banner.
 *
 * <p>
 * Bodies are already rendered, including the event-stream framing, and are
 * written as raw bytes.
 *
 * <p>
 * Each request makes one blocking upstream call while holding the caller's
 * identity lock, so the work runs on the bounded elastic scheduler.
 */
@RestController
@RequiredArgsConstructor
public class ProxyController {

    private final ProxyService proxyService;

    @PostMapping({ "/", "/chat/completions", "/quiet/", "/quiet/chat/completions" })
    public Mono<ResponseEntity<byte[]>> chat(@RequestBody(required = false) String body,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            ServerHttpRequest request) {
        String path = request.getPath().value();
        return Mono.fromCallable(() -> proxyService.handle(body, path, authorization))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ProxyController::toEntity);
    }

    static ResponseEntity<byte[]> toEntity(AssembledResponse response) {
        return ResponseEntity.status(response.status())
                .contentType(new MediaType(MediaType.parseMediaType(response.contentType()), StandardCharsets.UTF_8))
                .body(response.body().getBytes(StandardCharsets.UTF_8));
    }
}
