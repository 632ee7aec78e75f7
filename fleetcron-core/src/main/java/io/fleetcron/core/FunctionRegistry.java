package io.fleetcron.core;

import io.fleetcron.JobFunction;
import io.fleetcron.spi.ActionInvoker;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public class FunctionRegistry implements ActionInvoker {

    private final Map<String, JobFunction> functionsByName;

    public FunctionRegistry(List<? extends JobFunction> functions) {
        this.functionsByName = functions.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobFunction::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobFunction name: " + a.name());
                        }
                ));
    }

    public JobFunction getRequired(String name) {
        JobFunction function = functionsByName.get(name);
        if (function == null) {
            throw new UnknownFunctionException(name);
        }
        return function;
    }

    public boolean contains(String name) {
        return functionsByName.containsKey(name);
    }

    public Set<String> names() {
        return functionsByName.keySet();
    }

    @Override
    public Object invoke(String functionId, List<Object> args, Map<String, Object> kwargs, JobContext context) throws Exception {
        return getRequired(functionId).invoke(args, kwargs, context);
    }
}
