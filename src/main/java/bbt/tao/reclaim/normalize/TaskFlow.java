package bbt.tao.reclaim.normalize;

public enum TaskFlow {
    CREATE(true),
    CREATE_AT_TIME(true),
    UPDATE(false);

    private final boolean injectsDefaults;

    TaskFlow(boolean injectsDefaults) {
        this.injectsDefaults = injectsDefaults;
    }

    /** Update flows forward explicit fields only, so partial updates stay partial. */
    public boolean injectsDefaults() {
        return injectsDefaults;
    }
}
