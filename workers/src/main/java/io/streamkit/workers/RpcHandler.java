package io.streamkit.workers;

import io.streamkit.error.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Worker-side dispatcher: looks up the requested method by name and invokes it with the request's params.
 * An unknown method fails the call with a {@link ValidationException}.
 */
public final class RpcHandler implements WorkerHandler<RpcRequest, Object> {
    private final Map<String, RpcMethod> methods;

    private RpcHandler(Map<String, RpcMethod> methods) {
        this.methods = Map.copyOf(methods);
    }

    /**
     * Builds a handler from a tree of methods. Values are either {@link RpcMethod}s or nested maps, whose
     * entries are registered under {@code parent.child}.
     */
    public static RpcHandler of(Map<String, ?> tree) {
        Builder builder = builder();
        flatten("", tree, builder);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Object handle(RpcRequest request) throws Exception {
        RpcMethod method = methods.get(request.method());
        if (method == null) throw new ValidationException("Method " + request.method() + " not found");
        return method.invoke(request.params());
    }

    public Set<String> methodNames() {
        return methods.keySet();
    }

    private static void flatten(String prefix, Map<String, ?> tree, Builder builder) {
        for (Map.Entry<String, ?> e : tree.entrySet()) {
            String name = prefix.isEmpty() ? e.getKey() : prefix + "." + e.getKey();
            Object value = e.getValue();
            if (value instanceof RpcMethod m) {
                builder.method(name, m);
            } else if (value instanceof Map<?, ?> nested) {
                @SuppressWarnings("unchecked")
                Map<String, ?> children = (Map<String, ?>) nested;
                flatten(name, children, builder);
            } else {
                throw new ValidationException("RPC entry " + name + " is neither a method nor a namespace");
            }
        }
    }

    public static final class Builder {
        private final Map<String, RpcMethod> methods = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder method(String name, RpcMethod method) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(method, "method");
            if (methods.putIfAbsent(name, method) != null) {
                throw new ValidationException("Method " + name + " registered twice");
            }
            return this;
        }

        public RpcHandler build() {
            return new RpcHandler(methods);
        }
    }
}
