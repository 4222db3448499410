package kvlang.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import kvlang.compiler.ast.AstStatistics;
import kvlang.compiler.ast.KvModel;
import kvlang.compiler.codegen.GeneratorOptions;
import kvlang.compiler.codegen.PythonClassGenerator;
import kvlang.compiler.deps.CompiledModule;
import kvlang.compiler.deps.KvDependencyCompiler;
import kvlang.compiler.lexer.KvTokenizer;
import kvlang.compiler.lexer.LexException;
import kvlang.compiler.lexer.Token;
import kvlang.compiler.parser.KvParser;
import kvlang.compiler.parser.ParseException;
import kvlang.compiler.parser.ParseResult;
import kvlang.compiler.parser.ParserMode;
import kvlang.compiler.parser.ParsingError;
import kvlang.compiler.runtime.KvConfig;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * KV 编译器门面
 * <p>
 * 编译管道：
 * <pre>
 * KV 源码 → KvTokenizer（词法） → KvParser（语法，严格或容错）
 *        → KvDependencyCompiler（监听键） → PythonClassGenerator → Python 源码
 * </pre>
 * <p>
 * <b>错误处理</b>：
 * <ul>
 *   <li>严格模式下第一个词法或语法错误即以 {@link CompilationException} 抛出</li>
 *   <li>容错模式下错误收集在 {@link ParseResult#errors} 中，生成继续使用已解析的部分</li>
 * </ul>
 */
public final class KvCompiler {

    private static final Logger LOGGER = Logger.getLogger(KvCompiler.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private KvCompiler() {
        // 工具类，禁止实例化
    }

    /**
     * 按 {@code KV_PARSE_MODE} 配置的模式解析源码。
     */
    public static ParseResult parse(String source) throws CompilationException {
        return parse(source, ParserMode.fromString(KvConfig.PARSE_MODE));
    }

    /**
     * 解析 KV 源码
     *
     * @param source KV 源码
     * @param mode   解析模式
     * @return 解析结果；严格模式下错误列表总为空
     * @throws CompilationException 严格模式下遇到词法或语法错误时抛出
     */
    public static ParseResult parse(String source, ParserMode mode) throws CompilationException {
        List<Token> tokens;
        try {
            tokens = new KvTokenizer().tokenize(source);
        } catch (LexException e) {
            if (mode == ParserMode.STRICT) {
                throw new CompilationException(e.getMessage(), e);
            }
            // 词法错误无法同步，容错模式下返回空模块
            return new ParseResult(KvModel.Module.empty(), List.of(ParsingError.from(e)));
        }
        try {
            ParseResult result = new KvParser(tokens).parseWithRecovery(mode);
            if (KvConfig.DEBUG) {
                LOGGER.log(Level.INFO, "DEBUG: parsed {0}, errors={1}",
                        new Object[]{AstStatistics.of(result.module).summary(), result.errors.size()});
            }
            return result;
        } catch (ParseException e) {
            throw new CompilationException(e.getMessage(), e);
        }
    }

    /**
     * 严格解析并做依赖编译。
     */
    public static CompiledModule compile(String source) throws CompilationException {
        return new KvDependencyCompiler().compileModule(parse(source, ParserMode.STRICT).module);
    }

    public static String compileToPython(String source) throws CompilationException {
        return compileToPython(source, ParserMode.fromString(KvConfig.PARSE_MODE), GeneratorOptions.defaults());
    }

    public static String compileToPython(String source, GeneratorOptions options) throws CompilationException {
        return compileToPython(source, ParserMode.fromString(KvConfig.PARSE_MODE), options);
    }

    /**
     * 将 KV 源码编译为 Python 类定义
     *
     * @param source  KV 源码
     * @param mode    解析模式；容错模式下的解析错误记录为警告
     * @param options 生成选项
     * @return Python 源码
     * @throws CompilationException 严格模式下解析失败，或注册表资源无法加载时抛出
     */
    public static String compileToPython(String source, ParserMode mode, GeneratorOptions options)
            throws CompilationException {
        ParseResult result = parse(source, mode);
        for (ParsingError error : result.errors) {
            LOGGER.log(Level.WARNING, "recovered from parse error: {0}", error);
        }
        try {
            CompiledModule compiled = new KvDependencyCompiler().compileModule(result.module);
            return new PythonClassGenerator(options).generate(compiled);
        } catch (IllegalStateException e) {
            throw new CompilationException("KV 编译失败: " + e.getMessage(), e);
        }
    }

    /**
     * 将语法树序列化为 JSON，供工具链检查。
     */
    public static String toJson(KvModel.Module module) throws CompilationException {
        try {
            return MAPPER.writeValueAsString(module);
        } catch (JsonProcessingException e) {
            throw new CompilationException("JSON 序列化失败: " + e.getMessage(), e);
        }
    }

    /**
     * 编译异常
     */
    public static final class CompilationException extends Exception {
        public CompilationException(String message) {
            super(message);
        }

        public CompilationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
