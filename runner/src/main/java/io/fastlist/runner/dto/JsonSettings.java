// file: runner/src/main/java/io/fastlist/runner/dto/JsonSettings.java
package io.fastlist.runner.dto;

/**
 * Shape of the optional tuning file passed with --settings.
 * Every field is optional; absent fields keep their defaults.
 */
public class JsonSettings {
    public Integer pageSize;
    public String delimiter;
    public Integer maxAttempts;
    public Long baseBackoffMillis;
    public Long maxBackoffMillis;
    public Long requestTimeoutMillis;
    public Long monitorIntervalMillis;
    public Integer hintSampleSize;
    public Long drainTimeoutMillis;
}
