package com.example.skillgap.courses.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.skillgap.courses.cache.DynamicCourseCache;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

class HealthControllerTest {

  @Test
  void reportsUpWithCacheSize() {
    DynamicCourseCache cache = mock(DynamicCourseCache.class);
    when(cache.size()).thenReturn(7);
    when(cache.getMaxSize()).thenReturn(1000);

    ResponseEntity<Map<String, String>> response = new HealthController(cache).health().block();

    assertThat(response).isNotNull();
    assertThat(response.getBody())
        .containsEntry("status", "up")
        .containsEntry("courseCacheSize", "7")
        .containsEntry("courseCacheMaxSize", "1000");
  }
}
