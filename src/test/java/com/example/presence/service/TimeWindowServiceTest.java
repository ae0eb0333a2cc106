package com.example.presence.service;

import com.example.presence.dto.TimeWindowRequest;
import com.example.presence.exception.InvalidInputException;
import com.example.presence.repository.TimeWindowRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TimeWindowService")
class TimeWindowServiceTest {

    @Mock
    private TimeWindowRepository timeWindowRepository;

    @InjectMocks
    private TimeWindowService timeWindowService;

    @Test
    @DisplayName("Window spanning midnight is rejected and nothing is replaced")
    void rejectsMidnightWrap() {
        List<TimeWindowRequest> windows = List.of(
                new TimeWindowRequest("Entrée", LocalTime.of(8, 0), LocalTime.of(8, 30), true),
                new TimeWindowRequest("Nuit", LocalTime.of(23, 0), LocalTime.of(1, 0), true));

        assertThatThrownBy(() -> timeWindowService.replaceAll(windows))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("Nuit");

        verify(timeWindowRepository, never()).deleteAllInBatch();
        verify(timeWindowRepository, never()).saveAllAndFlush(anyList());
    }

    @Test
    @DisplayName("Empty window is rejected")
    void rejectsEmptyWindow() {
        List<TimeWindowRequest> windows = List.of(
                new TimeWindowRequest("Zero", LocalTime.of(8, 0), LocalTime.of(8, 0), true));

        assertThatThrownBy(() -> timeWindowService.replaceAll(windows))
                .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(timeWindowRepository);
    }

    @Test
    @DisplayName("Valid set replaces the stored windows")
    void replaces() {
        when(timeWindowRepository.findAllByOrderByStartTimeAscIdAsc()).thenReturn(List.of());

        timeWindowService.replaceAll(List.of(
                new TimeWindowRequest("Entrée", LocalTime.of(8, 0), LocalTime.of(8, 30), null)));

        verify(timeWindowRepository).deleteAllInBatch();
        verify(timeWindowRepository).saveAllAndFlush(anyList());
    }
}
