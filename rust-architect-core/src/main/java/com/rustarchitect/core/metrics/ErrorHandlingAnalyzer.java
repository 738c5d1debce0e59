package com.rustarchitect.core.metrics;

import com.rustarchitect.core.model.ErrorHandling;
import com.rustarchitect.core.scanner.SourceFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts error handling idioms over the scanned source files.
 *
 * <p>All counts are lexical, so occurrences inside comments and string literals are
 * counted too.
 */
public class ErrorHandlingAnalyzer {

    private static final Pattern ANYHOW = Pattern.compile("\\banyhow::|\\buse\\s+anyhow\\b");
    private static final Pattern THISERROR = Pattern.compile("\\bthiserror\\b");
    private static final Pattern ERROR_ENUM = Pattern.compile("\\benum\\s+(\\w*Error)\\b");
    private static final Pattern ERROR_DERIVE = Pattern.compile("#\\[derive\\([^)]*\\bError\\b[^)]*\\)\\]");
    private static final Pattern RESULT_RETURN = Pattern.compile("->\\s*(?:\\w+::)*Result\\s*<");
    private static final Pattern UNWRAP = Pattern.compile("\\.unwrap\\(\\)");
    private static final Pattern EXPECT = Pattern.compile("\\.expect\\(");
    private static final Pattern QUESTION_MARK = Pattern.compile("\\?(?=\\s*[;).,}])");

    public ErrorHandling analyze(List<SourceFile> files) {
        Objects.requireNonNull(files, "files must not be null");

        boolean usesAnyhow = false;
        boolean usesThiserror = false;
        List<ErrorHandling.CustomError> customErrors = new ArrayList<>();
        int errorDerives = 0;
        int resultReturns = 0;
        int unwrapCalls = 0;
        int expectCalls = 0;
        int questionMarks = 0;

        for (SourceFile file : files) {
            String content = file.content();
            usesAnyhow |= ANYHOW.matcher(content).find();
            usesThiserror |= THISERROR.matcher(content).find();

            Matcher errorEnum = ERROR_ENUM.matcher(content);
            while (errorEnum.find()) {
                customErrors.add(new ErrorHandling.CustomError(errorEnum.group(1), file.path()));
            }

            errorDerives += count(ERROR_DERIVE, content);
            resultReturns += count(RESULT_RETURN, content);
            unwrapCalls += count(UNWRAP, content);
            expectCalls += count(EXPECT, content);
            questionMarks += count(QUESTION_MARK, content);
        }

        return new ErrorHandling(usesAnyhow, usesThiserror, customErrors, errorDerives,
            resultReturns, unwrapCalls, expectCalls, questionMarks);
    }

    private static int count(Pattern pattern, String content) {
        int count = 0;
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
