package com.questrail.tracewire.packet;

/**
 * Kind of a {@link LogEntry}, serialized by wire id.
 */
public enum LogEntryType {
    SEPARATOR(0),
    ENTER_METHOD(1),
    LEAVE_METHOD(2),
    RESET_CALLSTACK(3),
    MESSAGE(100),
    WARNING(101),
    ERROR(102),
    INTERNAL_ERROR(103),
    COMMENT(104),
    VARIABLE_VALUE(105),
    CHECKPOINT(106),
    DEBUG(107),
    VERBOSE(108),
    FATAL(109),
    CONDITIONAL(110),
    ASSERT(111),
    TEXT(200),
    BINARY(201),
    GRAPHIC(202),
    SOURCE(203),
    OBJECT(204),
    WEB_CONTENT(205),
    SYSTEM(206),
    MEMORY_STATISTIC(207),
    DATABASE_RESULT(208),
    DATABASE_STRUCTURE(209);

    private final int id;

    LogEntryType(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public static LogEntryType fromId(int id) {
        for (LogEntryType t : values()) {
            if (t.id == id) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown log entry type id: " + id);
    }
}
