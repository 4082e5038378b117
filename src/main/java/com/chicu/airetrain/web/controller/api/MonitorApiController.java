package com.chicu.airetrain.web.controller.api;

import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.monitor.DriftAnalyzer;
import com.chicu.airetrain.monitor.DriftReport;
import com.chicu.airetrain.monitor.ModelMonitor;
import com.chicu.airetrain.monitor.PerformanceSample;
import com.chicu.airetrain.web.dto.DriftAnalyzeRequestDto;
import com.chicu.airetrain.web.dto.DriftReportDto;
import com.chicu.airetrain.web.dto.PerformanceSampleDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Приём метрик прода и отчётов о дрейфе.
 * Битые записи не дают 4xx. Монитор их отбрасывает, в ответе видно сколько.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping(value = "/api/monitor", produces = MediaType.APPLICATION_JSON_VALUE)
public class MonitorApiController {

    private final ModelMonitor monitor;
    private final DriftAnalyzer driftAnalyzer;
    private final RetrainingProperties props;
    private final Clock clock;

    @PostMapping("/performance")
    public Map<String, Object> performance(@RequestBody List<PerformanceSampleDto> samples) {
        long before = monitor.rejectedCount();
        int received = samples != null ? samples.size() : 0;

        if (samples != null) {
            for (PerformanceSampleDto s : samples) {
                if (s == null) {
                    monitor.recordPerformance(null);
                    continue;
                }
                monitor.recordPerformance(PerformanceSample.builder()
                        .timestamp(s.timestamp() != null ? s.timestamp() : clock.instant())
                        .metric(s.metric())
                        .value(s.value())
                        .source(s.source() != null ? s.source() : props.getMonitor().getSource())
                        .build());
            }
        }

        return counts(received, monitor.rejectedCount() - before);
    }

    @PostMapping("/drift")
    public Map<String, Object> drift(@RequestBody DriftReportDto report) {
        long before = monitor.rejectedCount();

        monitor.recordDrift(report == null ? null : DriftReport.builder()
                .timestamp(report.timestamp() != null ? report.timestamp() : clock.instant())
                .score(report.score())
                .featureScores(report.featureScores())
                .build());

        return counts(1, monitor.rejectedCount() - before);
    }

    @PostMapping("/drift/analyze")
    public DriftReport analyze(@Valid @RequestBody DriftAnalyzeRequestDto body) {
        DriftReport report = body.method() == null || body.method().isBlank()
                ? driftAnalyzer.analyze(body.baseline(), body.current())
                : driftAnalyzer.analyze(body.baseline(), body.current(), body.method());

        if (body.record()) {
            monitor.recordDrift(report);
        }
        log.info("📈 DRIFT analyzed score={} severity={} features={} recorded={}",
                report.score(), report.severity(), report.featureScores().size(), body.record());
        return report;
    }

    private static Map<String, Object> counts(int received, long rejected) {
        Map<String, Object> body = new HashMap<>();
        body.put("received", received);
        body.put("rejected", rejected);
        body.put("accepted", received - rejected);
        return body;
    }
}
