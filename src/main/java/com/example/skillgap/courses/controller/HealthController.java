package com.example.skillgap.courses.controller;

import com.example.skillgap.courses.cache.DynamicCourseCache;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final DynamicCourseCache cache;

    @GetMapping
    public Mono<ResponseEntity<Map<String, String>>> health() {
        return Mono.fromSupplier(() -> ResponseEntity.ok(Map.of(
                "status", "up",
                "courseCacheSize", String.valueOf(cache.size()),
                "courseCacheMaxSize", String.valueOf(cache.getMaxSize()))));
    }
}
