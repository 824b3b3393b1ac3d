package com.kcache.agent.report;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJO written to kcache_report.json by JsonReportWriter.
 * Block counters are null where the platform has no block I/O accounting.
 */
public class KcacheReport {

    @SerializedName("block_size")
    public int blockSize;

    @SerializedName("operations")
    public List<OperationRow> operations;

    @SerializedName("databases")
    public List<DatabaseRow> databases;

    public static class OperationRow {
        @SerializedName("principal_id") public long principalId;
        @SerializedName("database_id")  public long databaseId;
        /** Unsigned 64-bit, as a decimal string. */
        @SerializedName("operation_id") public String operationId;
        @SerializedName("symbol")       public String symbol;
        @SerializedName("calls")        public long calls;
        @SerializedName("reads")        public Long reads;
        @SerializedName("reads_bytes")  public Long readsBytes;
        @SerializedName("writes")       public Long writes;
        @SerializedName("writes_bytes") public Long writesBytes;
        @SerializedName("user_time")    public double userTime;
        @SerializedName("system_time")  public double systemTime;
    }

    public static class DatabaseRow {
        @SerializedName("database_id")  public long databaseId;
        @SerializedName("calls")        public long calls;
        @SerializedName("reads")        public Long reads;
        @SerializedName("writes")       public Long writes;
        @SerializedName("user_time")    public double userTime;
        @SerializedName("system_time")  public double systemTime;
    }
}
