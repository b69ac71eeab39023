package dev.mirror.worker.host;

/**
 * Kind of a destination entry.
 */
public enum EntryKind {

	FILE, DIRECTORY

}
