package com.typelens.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.typelens.compiler.analysis.AnalysisResult;
import com.typelens.compiler.analysis.SemanticDiagnostic;
import com.typelens.compiler.analysis.ShapeAnalyzer;
import com.typelens.compiler.analysis.types.LensType;
import com.typelens.compiler.ast.SourceLocation;
import com.typelens.compiler.lexer.Lexer;
import com.typelens.compiler.parser.ParseError;
import com.typelens.compiler.parser.ParseResult;
import com.typelens.compiler.parser.Parser;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 检查、求值执行器
 */
public class CheckRunner {

    private static final Logger LOG = Logger.getLogger(CheckRunner.class.getName());

    private final CheckOptions options;
    private final PrintStream out;
    private final PrintStream err;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public CheckRunner(CheckOptions options, PrintStream out, PrintStream err) {
        this.options = options;
        this.out = out;
        this.err = err;
    }

    public CheckRunner(CheckOptions options) {
        this(options, System.out, System.err);
    }

    /**
     * 单个源文件的检查结果：语法错误转换为 ERROR 诊断，排在语义诊断之前
     */
    public static final class FileReport {
        private final String file;
        private final List<SemanticDiagnostic> diagnostics;
        private final AnalysisResult analysis;

        FileReport(String file, List<SemanticDiagnostic> diagnostics, AnalysisResult analysis) {
            this.file = file;
            this.diagnostics = diagnostics;
            this.analysis = analysis;
        }

        public String getFile() { return file; }
        public List<SemanticDiagnostic> getDiagnostics() { return diagnostics; }

        /** 读取失败时为 null */
        public AnalysisResult getAnalysis() { return analysis; }

        public int count(SemanticDiagnostic.Severity severity) {
            int n = 0;
            for (SemanticDiagnostic d : diagnostics) {
                if (d.getSeverity() == severity) n++;
            }
            return n;
        }
    }

    /**
     * 检查多个文件
     *
     * @return 退出码：无错误（严格模式下也无警告）为 0，否则为 1
     */
    public int check(List<String> files) {
        List<FileReport> reports = new ArrayList<FileReport>();
        for (String file : files) {
            reports.add(checkFile(file));
        }

        int errors = 0;
        int warnings = 0;
        for (FileReport report : reports) {
            errors += report.count(SemanticDiagnostic.Severity.ERROR);
            warnings += report.count(SemanticDiagnostic.Severity.WARNING);
        }

        if (options.isJson()) {
            out.println(gson.toJson(toJson(reports, errors, warnings)));
        } else {
            for (FileReport report : reports) {
                for (SemanticDiagnostic d : report.getDiagnostics()) {
                    err.println(d);
                }
            }
            out.println(files.size() + " 个文件，" + errors + " 个错误，" + warnings + " 个警告");
        }

        boolean failed = errors > 0 || (options.isStrict() && warnings > 0);
        return failed ? 1 : 0;
    }

    /**
     * 求值文件中的所有非泛型别名并打印
     *
     * @return 退出码
     */
    public int eval(String file) {
        FileReport report = checkFile(file);
        for (SemanticDiagnostic d : report.getDiagnostics()) {
            err.println(d);
        }
        if (report.getAnalysis() != null) {
            for (Map.Entry<String, LensType> entry : report.getAnalysis().getEvaluatedAliases().entrySet()) {
                out.println("type " + entry.getKey() + " = " + entry.getValue().toDisplayString());
            }
        }
        return report.count(SemanticDiagnostic.Severity.ERROR) > 0 ? 1 : 0;
    }

    public FileReport checkFile(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            return unreadable(filePath, "文件不存在 - " + filePath);
        }
        try {
            String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            return checkSource(source, path.getFileName().toString());
        } catch (IOException e) {
            LOG.log(Level.WARNING, "读取失败: " + filePath, e);
            return unreadable(filePath, "无法读取文件 - " + filePath + ": " + e.getMessage());
        }
    }

    /**
     * 检查一段源码：容错解析后对成功解析的声明做语义分析
     */
    public FileReport checkSource(String source, String fileName) {
        Lexer lexer = new Lexer(source, fileName, err);
        Parser parser = new Parser(lexer, fileName);
        ParseResult parseResult = parser.parseTolerant();

        List<SemanticDiagnostic> diagnostics = new ArrayList<SemanticDiagnostic>();
        for (ParseError error : parseResult.getErrors()) {
            diagnostics.add(new SemanticDiagnostic(SemanticDiagnostic.Severity.ERROR, error.getMessage(),
                    locationOf(fileName, error)));
        }

        AnalysisResult analysis = new ShapeAnalyzer(options.getClassifierOptions())
                .analyze(parseResult.getProgram());
        diagnostics.addAll(analysis.getDiagnostics());
        LOG.fine(fileName + ": " + parseResult.getErrors().size() + " syntax errors, "
                + analysis.getDiagnostics().size() + " semantic diagnostics");
        return new FileReport(fileName, diagnostics, analysis);
    }

    private static FileReport unreadable(String filePath, String message) {
        List<SemanticDiagnostic> diagnostics = new ArrayList<SemanticDiagnostic>();
        diagnostics.add(new SemanticDiagnostic(SemanticDiagnostic.Severity.ERROR, message,
                new SourceLocation(filePath, 0, 0, 0, 0)));
        return new FileReport(filePath, diagnostics, null);
    }

    private static SourceLocation locationOf(String fileName, ParseError error) {
        if (error.getToken() == null) return new SourceLocation(fileName, 0, 0, 0, 0);
        return new SourceLocation(fileName, error.getLine(), error.getColumn(),
                error.getToken().getOffset(), error.getToken().getLexeme().length());
    }

    // ============ JSON 报告 ============

    JsonObject toJson(List<FileReport> reports, int errors, int warnings) {
        JsonObject root = new JsonObject();
        JsonArray files = new JsonArray();
        for (FileReport report : reports) {
            JsonObject file = new JsonObject();
            file.addProperty("file", report.getFile());

            JsonArray diagnostics = new JsonArray();
            for (SemanticDiagnostic d : report.getDiagnostics()) {
                JsonObject diag = new JsonObject();
                diag.addProperty("severity", d.getSeverity().name().toLowerCase());
                diag.addProperty("line", d.getLocation().getLine());
                diag.addProperty("column", d.getLocation().getColumn());
                diag.addProperty("length", d.getLength());
                diag.addProperty("message", d.getMessage());
                diagnostics.add(diag);
            }
            file.add("diagnostics", diagnostics);

            JsonObject aliases = new JsonObject();
            if (report.getAnalysis() != null) {
                for (Map.Entry<String, LensType> entry : report.getAnalysis().getEvaluatedAliases().entrySet()) {
                    aliases.addProperty(entry.getKey(), entry.getValue().toDisplayString());
                }
            }
            file.add("aliases", aliases);
            files.add(file);
        }
        root.add("files", files);
        root.addProperty("errors", errors);
        root.addProperty("warnings", warnings);
        root.addProperty("strict", options.isStrict());
        root.addProperty("zeroSign", options.getClassifierOptions().getZeroSignPolicy().name().toLowerCase());
        return root;
    }
}
