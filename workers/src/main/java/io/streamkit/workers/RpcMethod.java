package io.streamkit.workers;

import java.util.List;

/** A method exposed by an {@link RpcHandler}. Runs on a worker thread. */
@FunctionalInterface
public interface RpcMethod {
    Object invoke(List<Object> params) throws Exception;
}
