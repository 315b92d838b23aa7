package com.hallsync.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables for the relay server.
 *
 * Defaults live in the field initializers. A JSON file may override any subset
 * of them; keys that do not name a field are rejected so typos surface at startup.
 *
 * Example:
 * {
 *     "port": 4000,
 *     "enemyCount": 5,
 *     "outboundQueueLimit": 128
 * }
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class RelayConfig {

    public static final String CONFIG_PROPERTY = "hallsync.config";

    // Transport
    private int port = 4000;
    private String websocketPath = "/sync";
    private int maxFrameSize = 65536;
    private int readerIdleSeconds = 60;
    private int outboundQueueLimit = 256;

    // Enemy world
    private int enemyCount = 3;
    private long enemyTickMillis = 50;
    private double enemySpeed = 4.0;
    private double stopDistance = 12.0;
    private double detectionRange = 1000.0;
    private long respawnDelayMillis = 5000;
    private double hallHalfWidth = 550.0;
    private double hallHalfLength = 1375.0;
    private double boundaryMargin = 50.0;

    // Combat
    private double attackReach = 6.0;

    public RelayConfig() {
    }

    /**
     * Reads a JSON config file on top of the defaults.
     *
     * @throws IOException if the file cannot be read or contains unknown keys or bad values
     */
    public static RelayConfig load(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        RelayConfig config = new RelayConfig();
        try (Reader reader = Files.newBufferedReader(path)) {
            mapper.readerForUpdating(config).readValue(reader);
        }
        return config;
    }

    /**
     * Checks that every value is in range.
     *
     * @throws IllegalArgumentException naming the first offending key
     */
    public RelayConfig validate() {
        require(port > 0 && port <= 65535, "port must be in 1..65535");
        require(websocketPath != null && websocketPath.startsWith("/"), "websocketPath must start with '/'");
        require(maxFrameSize > 0, "maxFrameSize must be positive");
        require(readerIdleSeconds >= 0, "readerIdleSeconds must not be negative");
        require(outboundQueueLimit > 0, "outboundQueueLimit must be positive");
        require(enemyCount >= 0, "enemyCount must not be negative");
        require(enemyTickMillis > 0, "enemyTickMillis must be positive");
        require(enemySpeed >= 0, "enemySpeed must not be negative");
        require(stopDistance >= 0, "stopDistance must not be negative");
        require(detectionRange >= 0, "detectionRange must not be negative");
        require(respawnDelayMillis >= 0, "respawnDelayMillis must not be negative");
        require(hallHalfWidth > boundaryMargin, "hallHalfWidth must exceed boundaryMargin");
        require(hallHalfLength > boundaryMargin, "hallHalfLength must exceed boundaryMargin");
        require(boundaryMargin >= 0, "boundaryMargin must not be negative");
        require(attackReach > 0, "attackReach must be positive");
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    public int getPort() {
        return port;
    }

    public String getWebsocketPath() {
        return websocketPath;
    }

    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    public int getReaderIdleSeconds() {
        return readerIdleSeconds;
    }

    public int getOutboundQueueLimit() {
        return outboundQueueLimit;
    }

    public int getEnemyCount() {
        return enemyCount;
    }

    public long getEnemyTickMillis() {
        return enemyTickMillis;
    }

    public double getEnemySpeed() {
        return enemySpeed;
    }

    public double getStopDistance() {
        return stopDistance;
    }

    public double getDetectionRange() {
        return detectionRange;
    }

    public long getRespawnDelayMillis() {
        return respawnDelayMillis;
    }

    public double getHallHalfWidth() {
        return hallHalfWidth;
    }

    public double getHallHalfLength() {
        return hallHalfLength;
    }

    public double getBoundaryMargin() {
        return boundaryMargin;
    }

    public double getAttackReach() {
        return attackReach;
    }

    /**
     * Builder for programmatic configuration, mainly tests and embedding.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.config.port = port;
        builder.config.websocketPath = websocketPath;
        builder.config.maxFrameSize = maxFrameSize;
        builder.config.readerIdleSeconds = readerIdleSeconds;
        builder.config.outboundQueueLimit = outboundQueueLimit;
        builder.config.enemyCount = enemyCount;
        builder.config.enemyTickMillis = enemyTickMillis;
        builder.config.enemySpeed = enemySpeed;
        builder.config.stopDistance = stopDistance;
        builder.config.detectionRange = detectionRange;
        builder.config.respawnDelayMillis = respawnDelayMillis;
        builder.config.hallHalfWidth = hallHalfWidth;
        builder.config.hallHalfLength = hallHalfLength;
        builder.config.boundaryMargin = boundaryMargin;
        builder.config.attackReach = attackReach;
        return builder;
    }

    public static class Builder {
        private final RelayConfig config = new RelayConfig();

        public Builder port(int port) {
            config.port = port;
            return this;
        }

        public Builder websocketPath(String websocketPath) {
            config.websocketPath = websocketPath;
            return this;
        }

        public Builder maxFrameSize(int maxFrameSize) {
            config.maxFrameSize = maxFrameSize;
            return this;
        }

        public Builder readerIdleSeconds(int readerIdleSeconds) {
            config.readerIdleSeconds = readerIdleSeconds;
            return this;
        }

        public Builder outboundQueueLimit(int outboundQueueLimit) {
            config.outboundQueueLimit = outboundQueueLimit;
            return this;
        }

        public Builder enemyCount(int enemyCount) {
            config.enemyCount = enemyCount;
            return this;
        }

        public Builder enemyTickMillis(long enemyTickMillis) {
            config.enemyTickMillis = enemyTickMillis;
            return this;
        }

        public Builder enemySpeed(double enemySpeed) {
            config.enemySpeed = enemySpeed;
            return this;
        }

        public Builder stopDistance(double stopDistance) {
            config.stopDistance = stopDistance;
            return this;
        }

        public Builder detectionRange(double detectionRange) {
            config.detectionRange = detectionRange;
            return this;
        }

        public Builder respawnDelayMillis(long respawnDelayMillis) {
            config.respawnDelayMillis = respawnDelayMillis;
            return this;
        }

        public Builder hallHalfWidth(double hallHalfWidth) {
            config.hallHalfWidth = hallHalfWidth;
            return this;
        }

        public Builder hallHalfLength(double hallHalfLength) {
            config.hallHalfLength = hallHalfLength;
            return this;
        }

        public Builder boundaryMargin(double boundaryMargin) {
            config.boundaryMargin = boundaryMargin;
            return this;
        }

        public Builder attackReach(double attackReach) {
            config.attackReach = attackReach;
            return this;
        }

        public RelayConfig build() {
            return config.validate();
        }
    }

    @Override
    public String toString() {
        return "RelayConfig{" +
                "port=" + port +
                ", websocketPath='" + websocketPath + '\'' +
                ", outboundQueueLimit=" + outboundQueueLimit +
                ", enemyCount=" + enemyCount +
                ", enemyTickMillis=" + enemyTickMillis +
                '}';
    }
}
