/**
 * CodecRegistry.java
 *
 * 内置编解码函数的注册表，作为Spring Bean注入到服务中。
 * 包含两张表：格式化器 (text, json) 与解析器 (text, json)。
 * 调用方可以在创建会话前注册额外的命名函数；会话构造时通过 resolve() 一次性解析为 Codec。
 */
package club.ppmc.pyshell.codec;

import club.ppmc.pyshell.model.CodecChoice;
import club.ppmc.pyshell.model.ShellMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

public class CodecRegistry {

    private final Map<String, Function<Object, String>> formatters = new ConcurrentHashMap<>();
    private final Map<String, Function<String, Object>> parsers = new ConcurrentHashMap<>();

    public CodecRegistry(ObjectMapper objectMapper) {
        formatters.put("text", CodecRegistry::toText);
        formatters.put("json", data -> toJson(objectMapper, data));
        parsers.put("text", text -> text);
        parsers.put("json", text -> fromJson(objectMapper, text));
    }

    public CodecRegistry registerFormatter(String name, Function<Object, String> formatter) {
        formatters.put(name, formatter);
        return this;
    }

    public CodecRegistry registerParser(String name, Function<String, Object> parser) {
        parsers.put(name, parser);
        return this;
    }

    /**
     * 为一个会话解析编解码函数。
     * 未指定的角色使用模式对应的内置函数；binary 模式没有内置函数，对应角色为 null。
     *
     * @param mode 会话模式。
     * @param formatter 格式化器选择，可以为 null。
     * @param parser stdout 解析器选择，可以为 null。
     * @param stderrParser stderr 解析器选择，可以为 null。
     * @return 解析完成的不可变 Codec。
     * @throws IllegalArgumentException 如果指定的内置名称不存在。
     */
    public Codec resolve(
            ShellMode mode,
            CodecChoice<Function<Object, String>> formatter,
            CodecChoice<Function<String, Object>> parser,
            CodecChoice<Function<String, Object>> stderrParser) {
        return new Codec(
                resolveRole(formatters, "formatter", formatter, mode),
                resolveRole(parsers, "parser", parser, mode),
                resolveRole(parsers, "stderrParser", stderrParser, mode));
    }

    private static <F> F resolveRole(Map<String, F> table, String role, CodecChoice<F> choice, ShellMode mode) {
        if (choice == null) {
            // binary 模式不在表中，对应角色保持为空
            return mode == ShellMode.BINARY ? null : lookup(table, role, mode.codecName());
        }
        if (!choice.isBuiltIn()) {
            return choice.custom();
        }
        return lookup(table, role, choice.builtInName());
    }

    private static <F> F lookup(Map<String, F> table, String role, String name) {
        F function = table.get(name);
        if (function == null) {
            throw new IllegalArgumentException("未知的内置" + role + ": " + name);
        }
        return function;
    }

    static String toText(Object data) {
        if (data == null) {
            return "";
        }
        return data instanceof String text ? text : data.toString();
    }

    static String toJson(ObjectMapper objectMapper, Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new CodecException("无法将消息序列化为JSON: " + e.getOriginalMessage(), e);
        }
    }

    static Object fromJson(ObjectMapper objectMapper, String text) {
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            throw new CodecException("无法解析JSON记录: " + text, e);
        }
    }
}
