package com.designsync.engine.model;

public enum LayoutWrap {
    NO_WRAP,
    WRAP
}
