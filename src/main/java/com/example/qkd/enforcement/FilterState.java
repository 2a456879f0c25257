package com.example.qkd.enforcement;

public enum FilterState {
    /** 尚未执行过任何动作 */
    UNKNOWN,
    ALLOWED,
    BLOCKED
}
