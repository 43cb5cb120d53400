package com.example.guardianintake.service;

import com.example.guardianintake.dto.BatchIntakeResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Processes the inbox once at startup when {@code intake.inbox.run-on-startup=true}.
 */
@Component
@ConditionalOnProperty(name = "intake.inbox.run-on-startup", havingValue = "true")
public class InboxBatchRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(InboxBatchRunner.class);

    @Autowired
    private IntakePipelineService intakePipelineService;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        logger.info("🚀 Running inbox batch at startup");
        BatchIntakeResponse response = intakePipelineService.processInbox();
        if (response.getTotalFailed() > 0) {
            logger.warn("⚠️ {} documents failed; see the batch log above", response.getTotalFailed());
        }
    }
}
