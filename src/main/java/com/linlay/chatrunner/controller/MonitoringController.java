package com.linlay.chatrunner.controller;

import com.linlay.chatrunner.model.ApiResponse;
import com.linlay.chatrunner.monitor.PerformanceMonitor;
import com.linlay.chatrunner.monitor.PerformanceReport;
import com.linlay.chatrunner.monitor.PerformanceSnapshot;
import com.linlay.chatrunner.resilience.ResilientModelClient;
import com.linlay.chatrunner.service.ModelCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class MonitoringController {

    private static final Logger log = LoggerFactory.getLogger(MonitoringController.class);

    private final PerformanceMonitor performanceMonitor;
    private final ResilientModelClient modelClient;
    private final ModelCatalog modelCatalog;

    public MonitoringController(
            PerformanceMonitor performanceMonitor,
            ResilientModelClient modelClient,
            ModelCatalog modelCatalog
    ) {
        this.performanceMonitor = performanceMonitor;
        this.modelClient = modelClient;
        this.modelCatalog = modelCatalog;
    }

    @GetMapping("/performance")
    public ApiResponse<PerformanceReport> performance() {
        return ApiResponse.success(PerformanceReport.of(
                performanceMonitor.snapshot(),
                modelClient.cacheSize(),
                modelClient.circuitState()
        ));
    }

    @PostMapping("/performance/reset")
    public ApiResponse<PerformanceSnapshot> resetPerformance() {
        performanceMonitor.reset();
        log.info("Performance metrics reset by operator");
        return ApiResponse.success(performanceMonitor.snapshot());
    }

    @GetMapping("/health")
    public ApiResponse<Map<String, Object>> health() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", "UP");
        data.put("circuitState", modelClient.circuitState());
        data.put("models", modelCatalog.modelIds());
        return ApiResponse.success(data);
    }
}
