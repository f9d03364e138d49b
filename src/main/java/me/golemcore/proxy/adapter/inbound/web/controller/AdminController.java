package me.golemcore.proxy.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.proxy.adapter.inbound.web.dto.AnnouncementRequest;
import me.golemcore.proxy.adapter.inbound.web.dto.PurgeRequest;
import me.golemcore.proxy.port.outbound.UserStoragePort;
import me.golemcore.proxy.security.Xuid;
import me.golemcore.proxy.security.XuidFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Operator endpoints, guarded by the XUID secret passed as {@code ?secret=}.
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final XuidFactory xuidFactory;
    private final UserStoragePort storage;

    @GetMapping("/announcement")
    public Mono<ResponseEntity<Map<String, Object>>> getAnnouncement(
            @RequestParam(required = false) String secret) {
        if (!xuidFactory.matchesSecret(secret)) {
            return Mono.just(secretRequired());
        }
        return Mono.fromCallable(() -> ok("announcement", storage.getAnnouncement()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping("/announcement")
    public Mono<ResponseEntity<Map<String, Object>>> setAnnouncement(
            @RequestParam(required = false) String secret, @RequestBody AnnouncementRequest request) {
        if (!xuidFactory.matchesSecret(secret)) {
            return Mono.just(secretRequired());
        }
        return Mono.fromCallable(() -> {
            storage.setAnnouncement(request.getText());
            log.info("[API] Announcement updated");
            return ok("announcement", storage.getAnnouncement());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/announcement")
    public Mono<ResponseEntity<Map<String, Object>>> clearAnnouncement(
            @RequestParam(required = false) String secret) {
        if (!xuidFactory.matchesSecret(secret)) {
            return Mono.just(secretRequired());
        }
        return Mono.fromCallable(() -> {
            storage.setAnnouncement(null);
            log.info("[API] Announcement cleared");
            return ok("announcement", "");
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/purge")
    public Mono<ResponseEntity<Map<String, Object>>> purge(@RequestParam(required = false) String secret,
            @RequestBody PurgeRequest request) {
        if (!xuidFactory.matchesSecret(secret)) {
            return Mono.just(secretRequired());
        }
        if (request.getApiKey() == null || request.getApiKey().isBlank()) {
            throw new IllegalArgumentException("apiKey is required");
        }
        Xuid xuid = xuidFactory.derive(request.getApiKey().strip());
        return Mono.fromCallable(() -> {
            try {
                storage.remove(xuid);
            } catch (NoSuchElementException e) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("success", false);
                body.put("error", "user not found.");
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
            }
            log.info("[API] {} purged", xuid.pretty());
            return ok("xuid", xuid.shortId());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private static ResponseEntity<Map<String, Object>> ok(String key, Object value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put(key, value);
        return ResponseEntity.ok(body);
    }

    private static ResponseEntity<Map<String, Object>> secretRequired() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", "secret required.");
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);
    }
}
