package club.ppmc.meet.scheduler;

import club.ppmc.meet.metrics.SignalingMetrics;
import club.ppmc.meet.registry.RoomRegistry;
import club.ppmc.meet.service.SignalingGateway;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RoomMaintenanceTaskTest {

    private final SignalingGateway gateway = mock(SignalingGateway.class);
    private final RoomMaintenanceTask task = new RoomMaintenanceTask(gateway, new RoomRegistry(), new SignalingMetrics());

    @Test
    void sweepDelegatesToGateway() {
        when(gateway.sweepClosedConnections()).thenReturn(2);

        task.sweepClosedConnections();

        verify(gateway).sweepClosedConnections();
    }

    @Test
    void sweepFailureDoesNotEscapeTheScheduler() {
        when(gateway.sweepClosedConnections()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(task::sweepClosedConnections);
    }

    @Test
    void summaryCanBeLoggedWithEmptyCounters() {
        assertDoesNotThrow(task::logSignalingSummary);
    }
}
