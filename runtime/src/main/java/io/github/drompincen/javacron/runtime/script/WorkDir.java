package io.github.drompincen.javacron.runtime.script;

/**
 * Fixed file names of the per-run work directory.
 */
public final class WorkDir {

    public static final String PREFIX = "javacron_";
    public static final String INPUT = "input.json";
    public static final String EVENT = "event.json";
    public static final String VARIABLES = "variables.json";
    public static final String OUTPUT = "output.json";
    public static final String CONDITION = "condition.json";
    public static final String RUNNER = "run.sh";
    public static final String UPDATED_KEY = "__updated__";
    public static final String DIR_ENV = "JAVACRON_WORK_DIR";
    public static final int STALE_MINUTES = 5;

    private WorkDir() {}
}
