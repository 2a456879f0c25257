package com.example.qkd.enforcement;

/**
 * 网络封禁的执行面。两个方法都必须幂等：重复 block / allow 无副作用。
 */
public interface PacketFilter {

    void block();

    void allow();
}
