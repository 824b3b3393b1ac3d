package com.kcache.agent;

/** Privilege level of a Control API caller, as established by the host. */
public enum CallerPrivilege {
    ORDINARY,
    ELEVATED
}
