package com.example.qkd.enforcement;

/**
 * 健康查询失败（不可达 / 报错）时执行端怎么办。
 */
public enum UnknownStatusPolicy {
    /** 失败即封禁（fail closed） */
    BLOCK,
    /** 保持上一次已执行的状态 */
    LAST_KNOWN
}
