package org.carball.cflow.cfg;

public enum BlockKind {
    ENTRY,
    NORMAL,
    CONDITION,
    LOOP_HEADER,
    SWITCH,
    MERGE,
    EXIT
}
