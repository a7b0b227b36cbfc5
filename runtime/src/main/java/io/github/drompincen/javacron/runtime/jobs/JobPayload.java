package io.github.drompincen.javacron.runtime.jobs;

/**
 * Keys of the job payload map.
 */
public final class JobPayload {

    public static final String EVENT_ID = "eventId";
    public static final String LOG_ID = "logId";
    public static final String EVENT_TYPE = "eventType";
    public static final String CONTENT = "content";
    public static final String INPUT = "input";
    public static final String SERVER_ID = "serverId";
    public static final String ENV_VARS = "envVars";
    public static final String TIMEOUT_MS = "timeoutMs";
    public static final String HTTP_REQUEST = "httpRequest";
    public static final String TOOL_ACTION = "toolActionConfig";

    public static final String RESULT_SCRIPT_OUTPUT = "scriptOutput";
    public static final String RESULT_CONDITION = "condition";

    private JobPayload() {}
}
