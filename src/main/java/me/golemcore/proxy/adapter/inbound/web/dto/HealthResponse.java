package me.golemcore.proxy.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Deployment health as polled by uptime monitors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {
    private String admin;
    /** Monthly bandwidth in MiB, -1 when unknown. */
    private long bandwidth;
    /** Warning threshold in MiB. */
    private long bwarning;
    /** Cooldown in seconds at the current bandwidth. */
    private long cooldown;
    private String cpolicy;
    private long keyspace;
    /** Seconds since start. */
    private long uptime;
    private String version;
}
