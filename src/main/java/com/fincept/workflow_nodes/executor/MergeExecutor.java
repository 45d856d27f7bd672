package com.fincept.workflow_nodes.executor;

import com.fincept.workflow_nodes.executor.param.NodeParameterReader;
import com.fincept.workflow_nodes.executor.param.ParameterAccessor;
import com.fincept.workflow_nodes.model.node.BranchOutput;
import com.fincept.workflow_nodes.model.node.ClashHandling;
import com.fincept.workflow_nodes.model.node.JoinMode;
import com.fincept.workflow_nodes.model.node.MergeMode;
import com.fincept.workflow_nodes.model.node.TransformNodeType;
import com.fincept.workflow_nodes.model.record.DataRecord;
import com.fincept.workflow_nodes.model.record.RecordValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Executes MERGE nodes: input 1 (A) and input 2 (B) into a single output.
 *
 * Config shapes, by config.mode:
 *
 *   "append"          — A then B
 *   "mergeByPosition" — { "clashHandling": "preferFirst" | "preferSecond" | "addSuffix" }
 *   "mergeByKey"      — { "key1": "sym", "key2": "symbol", "joinMode": "inner" | "left" | "outer" }
 *   "chooseBranch"    — { "output": "input1" | "input2" }
 *
 * Merge by key always lets B's value win on a shared field name, regardless of clashHandling.
 * With addSuffix, the suffixed copies of a clashing field replace any field that already
 * has that name (A's own "x_1" is overwritten when "x" clashes).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MergeExecutor implements TransformNodeExecutor {

    public static final String PARAM_MODE           = "mode";
    public static final String PARAM_CLASH_HANDLING = "clashHandling";
    public static final String PARAM_KEY_1          = "key1";
    public static final String PARAM_KEY_2          = "key2";
    public static final String PARAM_JOIN_MODE      = "joinMode";
    public static final String PARAM_OUTPUT         = "output";

    static final String SUFFIX_FIRST  = "_1";
    static final String SUFFIX_SECOND = "_2";

    private final FieldResolver       fieldResolver;
    private final NodeParameterReader parameters;

    @Override
    public TransformNodeType supportedType() {
        return TransformNodeType.MERGE;
    }

    @Override
    public int outputCount() {
        return 1;
    }

    @Override
    public List<List<DataRecord>> execute(List<List<DataRecord>> inputs, ParameterAccessor params) {
        List<DataRecord> first  = TransformNodeExecutor.input(inputs, 0);
        List<DataRecord> second = TransformNodeExecutor.input(inputs, 1);

        MergeMode mode = parameters.option(params, PARAM_MODE, MergeMode.class, MergeMode.APPEND);

        List<DataRecord> merged = switch (mode) {
            case APPEND            -> append(first, second);
            case MERGE_BY_POSITION -> mergeByPosition(first, second,
                    parameters.option(params, PARAM_CLASH_HANDLING, ClashHandling.class, ClashHandling.PREFER_SECOND));
            case MERGE_BY_KEY      -> mergeByKey(first, second,
                    parameters.requiredString(params, PARAM_KEY_1),
                    parameters.requiredString(params, PARAM_KEY_2),
                    parameters.option(params, PARAM_JOIN_MODE, JoinMode.class, JoinMode.INNER));
            case CHOOSE_BRANCH     -> parameters.option(params, PARAM_OUTPUT, BranchOutput.class, BranchOutput.INPUT_1) == BranchOutput.INPUT_1
                    ? first
                    : second;
        };

        log.debug("Merge {}: {} + {} in, {} out", mode.configName(), first.size(), second.size(), merged.size());
        return List.of(List.copyOf(merged));
    }

    // ── Append ────────────────────────────────────────────────────────────────

    List<DataRecord> append(List<DataRecord> first, List<DataRecord> second) {
        List<DataRecord> out = new ArrayList<>(first.size() + second.size());
        out.addAll(first);
        out.addAll(second);
        return out;
    }

    // ── By position ───────────────────────────────────────────────────────────

    List<DataRecord> mergeByPosition(List<DataRecord> first, List<DataRecord> second, ClashHandling clashHandling) {
        int length = Math.max(first.size(), second.size());
        List<DataRecord> out = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            DataRecord a = i < first.size()  ? first.get(i)  : DataRecord.empty();
            DataRecord b = i < second.size() ? second.get(i) : DataRecord.empty();
            out.add(combine(a, b, clashHandling));
        }
        return out;
    }

    private DataRecord combine(DataRecord a, DataRecord b, ClashHandling clashHandling) {
        return switch (clashHandling) {
            case PREFER_FIRST  -> DataRecord.builder().putAll(b).putAll(a).build();
            case PREFER_SECOND -> DataRecord.builder().putAll(a).putAll(b).build();
            case ADD_SUFFIX    -> {
                DataRecord.Builder builder = DataRecord.builder().putAll(a).putAll(b);
                for (String key : a.keys()) {
                    if (!b.has(key)) continue;
                    builder.remove(key)
                           .put(key + SUFFIX_FIRST,  a.fields().get(key))
                           .put(key + SUFFIX_SECOND, b.fields().get(key));
                }
                yield builder.build();
            }
        };
    }

    // ── By key ────────────────────────────────────────────────────────────────

    /**
     * Hash join of A against an index of B. Every B match for an A record yields its own
     * output record (duplicate keys cross-multiply). Keys are compared by their string cast;
     * a record whose key is absent or null never matches.
     */
    List<DataRecord> mergeByKey(List<DataRecord> first, List<DataRecord> second,
                                String key1, String key2, JoinMode joinMode) {
        Map<String, List<DataRecord>> index = new LinkedHashMap<>();
        for (DataRecord b : second) {
            joinKey(b, key2).ifPresent(k -> index.computeIfAbsent(k, ignored -> new ArrayList<>()).add(b));
        }

        List<DataRecord> out = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();
        for (DataRecord a : first) {
            Optional<String> key = joinKey(a, key1);
            key.ifPresent(seenKeys::add);

            List<DataRecord> matches = key.map(index::get).orElse(List.of());
            if (matches.isEmpty()) {
                if (joinMode != JoinMode.INNER) out.add(a);
                continue;
            }
            for (DataRecord b : matches) {
                out.add(DataRecord.builder().putAll(a).putAll(b).build());
            }
        }

        if (joinMode == JoinMode.OUTER) {
            for (DataRecord b : second) {
                Optional<String> key = joinKey(b, key2);
                if (key.isEmpty() || !seenKeys.contains(key.get())) out.add(b);
            }
        }
        return out;
    }

    private Optional<String> joinKey(DataRecord record, String path) {
        return fieldResolver.resolve(record, path)
                .filter(value -> !(value instanceof RecordValue.Null))
                .map(RecordValue::asText);
    }
}
