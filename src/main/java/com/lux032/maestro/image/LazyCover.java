package com.lux032.maestro.image;

import java.util.Optional;

/**
 * 封面的延迟计算单元
 * 每个视图持有自己的单元; 解析最多执行一次, 之后直接返回缓存的结果 (包括失败)
 */
public final class LazyCover {

    @FunctionalInterface
    public interface Resolver {
        Optional<Image> resolve() throws CoverException;
    }

    private enum State {
        UNRESOLVED,
        RESOLVING,
        RESOLVED,
        FAILED
    }

    private State state = State.UNRESOLVED;
    private Optional<Image> value;
    private CoverException failure;

    /**
     * 获取结果, 首次调用时执行 resolver
     *
     * @throws IllegalStateException resolver 在执行过程中又访问了同一个单元
     */
    public synchronized Optional<Image> get(Resolver resolver) throws CoverException {
        switch (state) {
            case RESOLVED:
                return value;
            case FAILED:
                throw failure;
            case RESOLVING:
                throw new IllegalStateException("封面解析发生循环访问");
            default:
                break;
        }

        state = State.RESOLVING;
        try {
            value = resolver.resolve();
            state = State.RESOLVED;
            return value;
        } catch (CoverException e) {
            failure = e;
            state = State.FAILED;
            throw e;
        } catch (RuntimeException e) {
            state = State.UNRESOLVED;
            throw e;
        }
    }

    public synchronized boolean isResolved() {
        return state == State.RESOLVED || state == State.FAILED;
    }
}
