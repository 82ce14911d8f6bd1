package io.streamkit.workers;

import java.util.List;
import java.util.Objects;

/**
 * One call sent through {@link WorkerRpc}.
 *
 * @param id     unique per client, {@code rpc-N}
 * @param method dot-separated method name, e.g. {@code math.add}
 * @param params positional arguments, possibly containing {@code null}
 */
public record RpcRequest(String id, String method, List<Object> params) {
    public RpcRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(params, "params");
    }
}
