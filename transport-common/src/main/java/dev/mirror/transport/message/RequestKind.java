package dev.mirror.transport.message;

/**
 * Operations the worker accepts. Bulk operations touch the network or the whole tree and get the
 * long call timeout.
 */
public enum RequestKind {
    INIT("init", false),
    CLONE("clone", true),
    PULL("pull", true),
    GET_FILE_TREE("getFileTree", false),
    READ_FILE("readFile", false),
    SET_LOCAL_ROOT("setLocalRoot", false),
    SYNC_TO_LOCAL("syncToLocal", true),
    WIPE("wipe", true);

    private final String wireName;
    private final boolean bulk;

    RequestKind(String wireName, boolean bulk) {
        this.wireName = wireName;
        this.bulk = bulk;
    }

    public String wireName() {
        return wireName;
    }

    public boolean bulk() {
        return bulk;
    }
}
