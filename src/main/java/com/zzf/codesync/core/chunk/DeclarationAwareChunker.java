package com.zzf.codesync.core.chunk;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.comments.Comment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Line-window chunking that, for Java sources, prefers to start a chunk where a type,
 * field, constructor or method declaration (or its leading comment) begins. Sources that do
 * not parse are chunked as plain text.
 */
public final class DeclarationAwareChunker implements Chunker {
    private static final Logger logger = LoggerFactory.getLogger(DeclarationAwareChunker.class);

    private final LineWindowChunker windows;
    private final ParserConfiguration parserConfiguration;

    public DeclarationAwareChunker(LineWindowChunker windows) {
        this.windows = windows;
        this.parserConfiguration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(true);
    }

    @Override
    public List<Chunk> chunk(String path, String content) {
        if (path == null || !path.toLowerCase().endsWith(".java") || content == null || content.isEmpty()) {
            return windows.chunk(path, content);
        }
        Set<Integer> starts = declarationStarts(path, content);
        return windows.chunk(path, content, starts);
    }

    private Set<Integer> declarationStarts(String path, String content) {
        Set<Integer> starts = new TreeSet<Integer>();
        ParseResult<CompilationUnit> result;
        try {
            // JavaParser instances are not thread-safe
            result = new JavaParser(parserConfiguration).parse(content);
        } catch (RuntimeException e) {
            logger.warn("chunk.javaParseFailed path={} err={}", path, e.toString());
            return starts;
        }
        Optional<CompilationUnit> cu = result.getResult();
        if (!result.isSuccessful() || !cu.isPresent()) {
            logger.debug("chunk.javaParseFailed path={} problems={}", path, result.getProblems().size());
            return starts;
        }
        for (BodyDeclaration<?> decl : cu.get().findAll(BodyDeclaration.class)) {
            int line = decl.getBegin().map(p -> p.line).orElse(-1);
            Optional<Comment> comment = decl.getComment();
            if (comment.isPresent()) {
                int commentLine = comment.get().getBegin().map(p -> p.line).orElse(line);
                if (commentLine > 0 && (line < 0 || commentLine < line)) {
                    line = commentLine;
                }
            }
            if (line > 0) {
                starts.add(line);
            }
        }
        return starts;
    }
}
