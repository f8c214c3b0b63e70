package com.titanic.inference.api;

import com.titanic.inference.api.dto.HealthResponse;
import com.titanic.inference.common.RequestContext;
import com.titanic.inference.common.RequestContextHolder;
import com.titanic.inference.health.HealthChecker;
import com.titanic.inference.health.HealthReport;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
    private final HealthChecker healthChecker;

    public HealthController(HealthChecker healthChecker) {
        this.healthChecker = healthChecker;
    }

    @GetMapping("/health")
    public HealthResponse health(@RequestParam(name = "detailed", defaultValue = "false") boolean detailed) {
        HealthReport report = healthChecker.check(detailed);
        HealthResponse response = new HealthResponse();
        response.setStatus(report.status());
        response.setState(report.state().wire());
        response.setChecks(report.checks());
        RequestContext context = RequestContextHolder.get();
        if (context != null) {
            response.setTraceId(context.getTraceId());
            response.setRequestId(context.getRequestId());
        }
        return response;
    }
}
