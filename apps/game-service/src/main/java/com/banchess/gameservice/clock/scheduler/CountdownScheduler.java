package com.banchess.gameservice.clock.scheduler;

/**
 * CountdownScheduler
 * ---------------------------------------
 * 通用的“倒计时调度器”接口，完全独立于具体业务。
 *
 * 设计目标：
 *  - 提供统一的倒计时能力（启动/续上/停止）；
 *  - 到期时回调一次 TimeoutHandler，由上层把到期转成对局内的动作；
 *  - 不关心消息广播、游戏规则等业务细节。
 *
 * 行棋时钟与断线宽限期共用同一个调度器，以 key 前缀区分。
 */
public interface CountdownScheduler {

    /**
     * TimeoutHandler
     * ---------------------------------------
     * 到期时回调一次，由上层做权威业务处理。
     */
    interface TimeoutHandler {
        /**
         * 倒计时到期时触发。
         * @param key     业务键
         * @param owner   被计时的一方
         * @param version 启动时上层传入的版本（用于过期保护，格式由上层定义）
         */
        void onTimeout(String key, String owner, String version);
    }

    /**
     * 启动或续上指定 key 的倒计时；同 key 的旧任务会被取消。
     * @param key             业务键
     * @param owner           当前被计时的一方
     * @param deadlineEpochMs 绝对截止时间（毫秒）
     * @param version         版本
     * @param onTimeout       到期回调
     */
    void startOrResume(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout);

    /**
     * 停止指定 key 的倒计时（不打断正在执行的回调）。
     * @return true 表示确实取消了一个未到期的任务
     */
    boolean stop(String key);

    /** 指定 key 是否有未到期的任务 */
    boolean isScheduled(String key);
}
