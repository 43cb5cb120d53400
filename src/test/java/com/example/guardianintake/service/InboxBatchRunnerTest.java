package com.example.guardianintake.service;

import com.example.guardianintake.dto.BatchIntakeResponse;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InboxBatchRunnerTest {

    @Test
    void processesInboxOnStartup() throws Exception {
        IntakePipelineService pipeline = mock(IntakePipelineService.class);
        when(pipeline.processInbox()).thenReturn(new BatchIntakeResponse());
        InboxBatchRunner runner = new InboxBatchRunner();
        ReflectionTestUtils.setField(runner, "intakePipelineService", pipeline);

        runner.run(new DefaultApplicationArguments());

        verify(pipeline).processInbox();
    }

    @Test
    void missingInboxFailsStartup() throws Exception {
        IntakePipelineService pipeline = mock(IntakePipelineService.class);
        when(pipeline.processInbox()).thenThrow(new IOException("Inbox directory not found: inbox"));
        InboxBatchRunner runner = new InboxBatchRunner();
        ReflectionTestUtils.setField(runner, "intakePipelineService", pipeline);

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
            .isInstanceOf(IOException.class);
    }
}
