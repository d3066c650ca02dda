package org.javai.recovery.substitute;

/**
 * Declared traits of a tool that substitution constraints can exclude.
 */
public enum ToolTag {
    /**
     * Needs root or raw-socket capabilities to run usefully.
     */
    REQUIRES_PRIVILEGES,

    /**
     * Noticeably slower than its peers.
     */
    SLOW
}
