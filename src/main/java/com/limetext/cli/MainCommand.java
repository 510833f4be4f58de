package com.limetext.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.limetext.config.Constants;
import com.limetext.document.FeatureInfo;
import com.limetext.document.IndexMode;
import com.limetext.document.IndexedDocument;
import com.limetext.sampling.NeighborhoodSampler;
import com.limetext.sampling.Perturbations;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;

@Command(
    name = "lime-text",
    description = "🔬 文本分类器局部解释工具：特征索引与邻域扰动",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.FeaturesSubcommand.class,
        MainCommand.PerturbSubcommand.class,
        MainCommand.RemoveSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--mode"}, description = "索引模式 (bow|positional)", defaultValue = "bow")
    private String mode;

    @Option(names = {"--file"}, description = "从文件读取待解释文本（UTF-8）")
    private Path file;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔬 文本分类器局部解释工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private IndexedDocument loadDocument(String inlineText) throws IOException {
        String text;
        if (file != null) {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } else if (inlineText != null) {
            text = inlineText;
        } else {
            throw new CommandLine.ParameterException(new CommandLine(this), "请提供文本参数或 --file");
        }
        if (text.length() > Constants.MAX_TEXT_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "文本长度超过限制（最大 " + Constants.MAX_TEXT_LENGTH + " 字符）");
        }
        return IndexedDocument.of(text, IndexMode.fromName(mode));
    }

    private int sanitizeSampleCount(int rawSamples) {
        if (rawSamples < 1) {
            System.err.printf("⚠️ samples=%d 非法，已使用 1%n", rawSamples);
            return 1;
        }
        if (rawSamples > Constants.CLI_MAX_SAMPLES) {
            System.err.printf("⚠️ samples=%d 超过上限 %d，已自动限制%n", rawSamples, Constants.CLI_MAX_SAMPLES);
            return Constants.CLI_MAX_SAMPLES;
        }
        return rawSamples;
    }

    private static void printJson(Object value) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    @Command(name = "features", description = "📑 列出文档的全部特征及其出现位置")
    static class FeaturesSubcommand implements Callable<Integer> {

        @Parameters(description = "待索引文本", arity = "0..1")
        private String text;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexedDocument document = main.loadDocument(text);
                if ("json".equalsIgnoreCase(format)) {
                    printJson(document.features());
                } else {
                    printFeatures(document);
                }
                return 0;
            } catch (CommandLine.ParameterException parameterException) {
                throw parameterException;
            } catch (Exception exception) {
                System.err.println("❌ 索引失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printFeatures(IndexedDocument document) {
            System.out.println("📊 模式: " + document.mode().wireName()
                + "，片段数: " + document.numTokens() + "，特征数: " + document.numFeatures());
            for (FeatureInfo feature : document.features()) {
                System.out.printf("%4d  %-20s %s%n", feature.id(), feature.text(), Arrays.toString(feature.positions()));
            }
        }
    }

    @Command(name = "perturb", description = "🎲 生成随机扰动样本及其与原文的距离")
    static class PerturbSubcommand implements Callable<Integer> {

        @Parameters(description = "待扰动文本", arity = "0..1")
        private String text;

        @Option(names = {"-n", "--samples"}, description = "样本数（含原文）", defaultValue = "" + Constants.CLI_DEFAULT_SAMPLES)
        private int samples;

        @Option(names = {"--seed"}, description = "随机种子，便于复现")
        private Long seed;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexedDocument document = main.loadDocument(text);
                Random random = seed == null ? new Random() : new Random(seed);
                Perturbations perturbations = new NeighborhoodSampler(random)
                    .perturb(document, main.sanitizeSampleCount(samples));
                List<PerturbedRow> rows = toRows(perturbations);
                if ("json".equalsIgnoreCase(format)) {
                    printJson(rows);
                } else {
                    printRows(rows);
                }
                return 0;
            } catch (CommandLine.ParameterException parameterException) {
                throw parameterException;
            } catch (Exception exception) {
                System.err.println("❌ 扰动失败: " + exception.getMessage());
                return 1;
            }
        }

        private List<PerturbedRow> toRows(Perturbations perturbations) {
            List<PerturbedRow> rows = new ArrayList<>(perturbations.size());
            for (int index = 0; index < perturbations.size(); index++) {
                StringBuilder mask = new StringBuilder();
                for (double bit : perturbations.data()[index]) {
                    mask.append(bit > 0 ? '1' : '0');
                }
                rows.add(new PerturbedRow(index, mask.toString(), perturbations.distances()[index],
                    perturbations.texts().get(index)));
            }
            return rows;
        }

        private void printRows(List<PerturbedRow> rows) {
            for (PerturbedRow row : rows) {
                System.out.printf("%4d  %s  %8.4f  %s%n", row.index(), row.mask(), row.distance(),
                    row.text().replace("\n", " "));
            }
        }
    }

    @Command(name = "remove", description = "✂️ 删除指定特征后输出重建文本")
    static class RemoveSubcommand implements Callable<Integer> {

        @Parameters(description = "原始文本", arity = "0..1")
        private String text;

        @Option(names = {"--ids"}, description = "要删除的特征编号，逗号分隔", split = ",")
        private List<Integer> ids;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                IndexedDocument document = main.loadDocument(text);
                System.out.println(document.remove(ids == null ? List.of() : ids));
                return 0;
            } catch (CommandLine.ParameterException parameterException) {
                throw parameterException;
            } catch (Exception exception) {
                System.err.println("❌ 删除失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    public record PerturbedRow(int index, String mask, double distance, String text) {
    }
}
