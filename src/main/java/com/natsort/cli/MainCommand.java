package com.natsort.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.natsort.config.Constants;
import com.natsort.config.SortConfig;
import com.natsort.order.NaturalSort;
import com.natsort.order.PartialOrdering;
import com.natsort.order.TokenSequence;
import com.natsort.order.UnorderablePairException;
import com.natsort.text.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "natsort",
    description = "🔢 自然顺序字符串排序工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.SortSubcommand.class,
        MainCommand.CompareSubcommand.class,
        MainCommand.TokensSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔢 自然顺序字符串排序工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private String sanitizeFormat(String rawFormat) {
        if (Constants.FORMAT_TEXT.equalsIgnoreCase(rawFormat) || Constants.FORMAT_JSON.equalsIgnoreCase(rawFormat)) {
            return rawFormat.toLowerCase(Locale.ROOT);
        }
        throw new CommandLine.ParameterException(new CommandLine(this),
            "不支持的输出格式: " + rawFormat + "（可选 text|json）");
    }

    private int sanitizeMaxLines(int rawMaxLines) {
        if (rawMaxLines <= 0) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "最大行数必须为正数: " + rawMaxLines);
        }
        return rawMaxLines;
    }

    private static void printJson(Object value) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    @Command(name = "sort", description = "📋 按自然顺序排序输入行（无文件参数时读取标准输入）")
    static class SortSubcommand implements Callable<Integer> {

        @Parameters(description = "输入文件路径", arity = "0..*")
        private List<Path> inputFiles;

        @Option(names = {"-r", "--reverse"}, description = "降序输出")
        private boolean reverse;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--max-lines"}, description = "允许读取的最大行数",
            defaultValue = "" + Constants.MAX_INPUT_LINES)
        private int maxLines;

        @Option(names = {"--charset"}, description = "输入字符集", defaultValue = "UTF-8")
        private Charset charset;

        @ParentCommand
        private MainCommand main;

        InputStream stdin = System.in;

        @Override
        public Integer call() {
            SortConfig config = SortConfig.defaults();
            config.setReverse(reverse);
            config.setFormat(main.sanitizeFormat(format));
            config.setMaxInputLines(main.sanitizeMaxLines(maxLines));
            if (charset != null) {
                config.setCharset(charset);
            }

            try {
                List<String> lines = readLines(config);
                NaturalSort.sort(lines, config.isReverse());
                if (config.isJsonFormat()) {
                    printJson(lines);
                } else {
                    lines.forEach(System.out::println);
                }
                return 0;
            } catch (UnorderablePairException exception) {
                logger.debug("排序失败: {}", exception.getMessage());
                System.err.println("❌ 无法排序: \"" + exception.getLeft() + "\" 与 \"" + exception.getRight()
                    + "\" 在同一位置分别为数字与字母");
                return 1;
            } catch (IOException exception) {
                logger.debug("读取输入失败: {}", exception.getMessage());
                System.err.println("❌ 读取输入失败: " + exception.getMessage());
                return 1;
            }
        }

        private List<String> readLines(SortConfig config) throws IOException {
            List<String> lines = new ArrayList<>();
            if (inputFiles == null || inputFiles.isEmpty()) {
                readInto(new BufferedReader(new InputStreamReader(stdin, config.getCharset())), lines, config);
                return lines;
            }
            for (Path inputFile : inputFiles) {
                try (BufferedReader reader = Files.newBufferedReader(inputFile, config.getCharset())) {
                    readInto(reader, lines, config);
                }
            }
            return lines;
        }

        private void readInto(BufferedReader reader, List<String> lines, SortConfig config) throws IOException {
            String line;
            while ((line = reader.readLine()) != null) {
                if (lines.size() >= config.getMaxInputLines()) {
                    throw new IOException("输入超过 " + config.getMaxInputLines() + " 行上限");
                }
                lines.add(line);
            }
        }
    }

    @Command(name = "compare", description = "⚖️ 比较两个字符串的自然顺序")
    static class CompareSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "左侧字符串")
        private String left;

        @Parameters(index = "1", description = "右侧字符串")
        private String right;

        @Override
        public Integer call() {
            PartialOrdering ordering = TokenSequence.of(left).compareWith(TokenSequence.of(right));
            System.out.println(ordering);
            return 0;
        }
    }

    @Command(name = "tokens", description = "🔤 显示字符串的分词结果")
    static class TokensSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "要分词的字符串")
        private String text;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            TokenSequence sequence = TokenSequence.of(text);
            try {
                if (Constants.FORMAT_JSON.equals(main.sanitizeFormat(format))) {
                    printJson(toJsonView(sequence));
                } else {
                    for (Token token : sequence.tokens()) {
                        System.out.println(token.kind() + "\t" + token.text());
                    }
                }
                return 0;
            } catch (IOException exception) {
                System.err.println("❌ 输出失败: " + exception.getMessage());
                return 1;
            }
        }

        private List<Map<String, Object>> toJsonView(TokenSequence sequence) {
            List<Map<String, Object>> view = new ArrayList<>();
            for (Token token : sequence.tokens()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("kind", token.kind().name());
                entry.put("text", token.text());
                if (token instanceof Token.Number number) {
                    entry.put("value", number.value());
                }
                view.add(entry);
            }
            return view;
        }
    }
}
