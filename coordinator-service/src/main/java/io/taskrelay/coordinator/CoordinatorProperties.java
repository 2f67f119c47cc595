package io.taskrelay.coordinator;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.Objects;
import org.springframework.validation.annotation.Validated;

/**
 * Coordinator background duties ({@code taskrelay.coordinator.*}).
 */
@Validated
public class CoordinatorProperties {

  @NotNull
  private Duration livenessTimeout = Duration.ofMinutes(5);
  @NotNull
  private Duration livenessCheckInterval = Duration.ofMinutes(1);
  @NotNull
  private Duration resendInterval = Duration.ofMinutes(1);

  /**
   * How long an agent may go without a heartbeat before it is reported as unresponsive.
   */
  public Duration getLivenessTimeout() {
    return livenessTimeout;
  }

  public void setLivenessTimeout(Duration livenessTimeout) {
    this.livenessTimeout = requirePositive("livenessTimeout", livenessTimeout);
  }

  public Duration getLivenessCheckInterval() {
    return livenessCheckInterval;
  }

  public void setLivenessCheckInterval(Duration livenessCheckInterval) {
    this.livenessCheckInterval = requirePositive("livenessCheckInterval", livenessCheckInterval);
  }

  public Duration getResendInterval() {
    return resendInterval;
  }

  public void setResendInterval(Duration resendInterval) {
    this.resendInterval = requirePositive("resendInterval", resendInterval);
  }

  private static Duration requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }
}
