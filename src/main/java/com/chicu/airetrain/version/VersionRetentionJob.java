package com.chicu.airetrain.version;

import com.chicu.airetrain.config.RetrainingProperties;
import com.chicu.airetrain.engine.SchedulerService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class VersionRetentionJob {

    static final String TASK_KEY = "versions|retention";

    private final ModelVersionStore store;
    private final SchedulerService scheduler;
    private final RetrainingProperties props;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        long every = props.getVersions().getRetentionCheckIntervalSec();
        scheduler.scheduleAtFixedRate(TASK_KEY, store::enforceRetention, every, every);
    }
}
