package com.siqiu.scriptmonitor.execution;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExecutionQueryServiceTest {

    @Mock ExecutionRecordRepository records;
    @InjectMocks ExecutionQueryService service;

    @Test
    void missingExecutionThrowsNotFound() {
        UUID id = UUID.randomUUID();
        when(records.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getOrThrow(id))
                .isInstanceOf(ExecutionNotFoundException.class)
                .hasMessageContaining(id.toString());
    }

    @Test
    void limitIsClamped() {
        when(records.findRecentBySchedule(anyLong(), anyInt())).thenReturn(List.of());

        service.recent(1L, 0);
        service.recent(1L, 10_000);

        verify(records).findRecentBySchedule(1L, 1);
        verify(records).findRecentBySchedule(1L, ExecutionQueryService.MAX_LIMIT);
    }
}
