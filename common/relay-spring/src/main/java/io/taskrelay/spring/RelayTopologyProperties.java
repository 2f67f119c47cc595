package io.taskrelay.spring;

import io.taskrelay.RelayTopology;
import io.taskrelay.TopologyDefaults;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Exchange and queue names ({@code taskrelay.topology.*}).
 */
@Validated
@ConfigurationProperties(prefix = "taskrelay.topology")
public class RelayTopologyProperties {

    @NotBlank
    private String exchange = TopologyDefaults.EXCHANGE;
    @NotBlank
    private String coordinatorInbox = TopologyDefaults.COORDINATOR_INBOX;
    @NotBlank
    private String workerInbox = TopologyDefaults.WORKER_INBOX;
    @NotBlank
    private String requirementsInbox = TopologyDefaults.REQUIREMENTS_INBOX;
    @NotBlank
    private String workRequestInbox = TopologyDefaults.WORK_REQUEST_INBOX;

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getCoordinatorInbox() {
        return coordinatorInbox;
    }

    public void setCoordinatorInbox(String coordinatorInbox) {
        this.coordinatorInbox = coordinatorInbox;
    }

    public String getWorkerInbox() {
        return workerInbox;
    }

    public void setWorkerInbox(String workerInbox) {
        this.workerInbox = workerInbox;
    }

    public String getRequirementsInbox() {
        return requirementsInbox;
    }

    public void setRequirementsInbox(String requirementsInbox) {
        this.requirementsInbox = requirementsInbox;
    }

    public String getWorkRequestInbox() {
        return workRequestInbox;
    }

    public void setWorkRequestInbox(String workRequestInbox) {
        this.workRequestInbox = workRequestInbox;
    }

    public RelayTopology toTopology() {
        return new RelayTopology(exchange, coordinatorInbox, workerInbox, requirementsInbox, workRequestInbox);
    }
}
