package com.qiyi.webagent.agent;

/**
 * Agent 对外统一接口。
 *
 * <p>一个 Agent 代表一种运行形态（例如：stdio 协议服务）。start/stop 的并发控制由 {@link AbstractAgent} 负责。</p>
 */
public interface IAgent {
    void start();

    void stop();
}
