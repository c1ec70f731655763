package com.qiyi.webagent.agent;

import com.qiyi.webagent.util.AppLog;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Agent 基类，统一封装生命周期：同一个 Agent 实例禁止重复 start()，stop() 可重复调用。
 */
public abstract class AbstractAgent implements IAgent {
    private final AtomicBoolean started = new AtomicBoolean(false);

    protected String agentName() {
        return this.getClass().getSimpleName();
    }

    @Override
    public final void start() {
        if (!started.compareAndSet(false, true)) {
            AppLog.warn(agentName() + " already started, ignoring duplicate start()");
            return;
        }
        try {
            AppLog.info(agentName() + " start() begin");
            doStart();
            AppLog.info(agentName() + " start() done");
        } catch (RuntimeException e) {
            AppLog.error(agentName() + " start() failed", e);
            stop();
            throw e;
        }
    }

    @Override
    public final void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        try {
            AppLog.info(agentName() + " stop() begin");
            doStop();
        } catch (Exception e) {
            AppLog.error(agentName() + " stop() failed", e);
        } finally {
            AppLog.info(agentName() + " stop() done");
        }
    }

    protected abstract void doStart();

    protected void doStop() {
    }

    protected boolean isRunning() {
        return started.get();
    }
}
