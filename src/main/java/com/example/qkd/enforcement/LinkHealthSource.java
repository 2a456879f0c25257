package com.example.qkd.enforcement;

import com.example.qkd.model.LinkHealthSnapshot;

/**
 * 执行端读取链路健康的拉取接口。
 * 实现方查询失败时抛 {@link com.example.qkd.exception.LinkHealthUnavailableException}。
 */
public interface LinkHealthSource {

    LinkHealthSnapshot checkLinkHealth();
}
