package com.imperium.exhibitlinker.model.link;

/**
 * Bates 页码定位的状态：NOT_STARTED → SCANNING → FOUND | EXHAUSTED_NO_MATCH。
 */
public enum PageScanState {
    NOT_STARTED,
    SCANNING,
    FOUND,
    EXHAUSTED_NO_MATCH
}
