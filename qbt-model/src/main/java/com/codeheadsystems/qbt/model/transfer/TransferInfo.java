package com.codeheadsystems.qbt.model.transfer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for {@code GET /api/v2/transfer/info}: global transfer statistics for the
 * current server session.
 *
 * @param downloadSpeed     global download speed in bytes per second
 * @param downloadedData    bytes downloaded this session
 * @param uploadSpeed       global upload speed in bytes per second
 * @param uploadedData      bytes uploaded this session
 * @param downloadRateLimit download limit in bytes per second, 0 when unlimited
 * @param uploadRateLimit   upload limit in bytes per second, 0 when unlimited
 * @param dhtNodes          DHT nodes connected to
 * @param connectionStatus  {@code connected}, {@code firewalled} or {@code disconnected}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TransferInfo(
    @JsonProperty("dl_info_speed") long downloadSpeed,
    @JsonProperty("dl_info_data") long downloadedData,
    @JsonProperty("up_info_speed") long uploadSpeed,
    @JsonProperty("up_info_data") long uploadedData,
    @JsonProperty("dl_rate_limit") long downloadRateLimit,
    @JsonProperty("up_rate_limit") long uploadRateLimit,
    @JsonProperty("dht_nodes") int dhtNodes,
    @JsonProperty("connection_status") String connectionStatus) {
}
