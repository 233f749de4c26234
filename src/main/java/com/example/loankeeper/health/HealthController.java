package com.example.loankeeper.health;

import com.example.loankeeper.models.JobType;
import com.example.loankeeper.scheduling.JobLauncher;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.info.BuildProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final BuildProperties buildProperties;
    private final JobLauncher jobLauncher;
    private final Clock clock;
    private final String env;

    public HealthController(@Value("${app.env:local}") String env,
                            ObjectProvider<BuildProperties> buildProperties,
                            JobLauncher jobLauncher,
                            Clock clock) {
        this.env = env;
        this.buildProperties = buildProperties.getIfAvailable();
        this.jobLauncher = jobLauncher;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("ts", clock.instant().toString());
        body.put("env", env);
        body.put("app", buildProperties != null ? buildProperties.getName() : "loan-keeper");
        body.put("version", buildProperties != null ? buildProperties.getVersion() : "dev");
        body.put("running_jobs", jobLauncher.running().stream().map(JobType::wireName).toList());
        return ResponseEntity.ok(body);
    }
}
