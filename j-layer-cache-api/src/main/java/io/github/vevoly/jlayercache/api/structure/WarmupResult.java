package io.github.vevoly.jlayercache.api.structure;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 一次预热的执行结果。超出时间预算属于可接受的部分预热，不是错误。
 * <p>
 * Outcome of one warmup run. Running out of budget is an accepted partial warmup, not an error.
 *
 * @author vevoly
 */
@Value
@Builder
public class WarmupResult {

    /** 实际写入缓存的条目数 / entries written to the cache */
    int warmedKeys;

    /** 成功完成的策略 / strategies that completed */
    @Singular("completed")
    List<String> completed;

    /** 执行失败的策略 / strategies that failed */
    @Singular("failed")
    List<String> failed;

    /** 因预算耗尽被跳过的策略 / strategies skipped because the budget ran out */
    @Singular("skipped")
    List<String> skipped;

    /** 总耗时（毫秒）/ total elapsed time (ms) */
    long elapsedMillis;

    /** 是否触达时间预算 / whether the time budget was hit */
    boolean budgetExceeded;
}
