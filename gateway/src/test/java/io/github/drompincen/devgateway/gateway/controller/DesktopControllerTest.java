package io.github.drompincen.devgateway.gateway.controller;

import io.github.drompincen.devgateway.protocol.api.DesktopStatus;
import io.github.drompincen.devgateway.runtime.desktop.DesktopServerManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DesktopControllerTest {

    @Mock private DesktopServerManager desktop;

    private DesktopController controller;

    @BeforeEach
    void setUp() {
        controller = new DesktopController(desktop);
    }

    @Test
    void statusReturnsProbeResult() {
        when(desktop.status()).thenReturn(new DesktopStatus(true, "Desktop server is running", 5999, ":99"));

        var response = controller.status();

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody().port()).isEqualTo(5999);
        assertThat(response.getBody().display()).isEqualTo(":99");
    }

    @Test
    void successfulStartReturns200() {
        when(desktop.ensureRunning()).thenReturn(DesktopStatus.of(true, "Desktop server started"));

        var response = controller.start();

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody().running()).isTrue();
    }

    @Test
    void failedStartReturns500WithMessage() {
        when(desktop.ensureRunning()).thenReturn(DesktopStatus.of(false, "Xvnc is not installed"));

        var response = controller.start();

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody().message()).isEqualTo("Xvnc is not installed");
    }

    @Test
    void concurrentStartIsReportedAsFailure() {
        when(desktop.ensureRunning()).thenReturn(DesktopStatus.of(false, "Desktop server is already starting"));

        var response = controller.start();

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody().message()).contains("already starting");
    }
}
