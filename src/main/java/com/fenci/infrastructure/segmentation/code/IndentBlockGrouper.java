package com.fenci.infrastructure.segmentation.code;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Groups indentation-delimited code (Python style) into logical blocks with an
 * indentation stack.
 *
 * <ol>
 *   <li>The stack starts as {@code [0]}; blank lines are skipped.</li>
 *   <li>Import lines are emitted alone, flushing the pending block first.</li>
 *   <li>On dedent the stack is popped until its top is no deeper than the line; the pending
 *       block is flushed when it sits at or below the new top. On indent the width is pushed.</li>
 *   <li>A header line (ending in {@code :} but not {@code ::}) flushes the pending block
 *       and starts a new one.</li>
 *   <li>Other lines are appended, space-joined; the block is flushed early when the next line
 *       is not deeper than the block and is not itself a header.</li>
 * </ol>
 */
@Component
public class IndentBlockGrouper {

    public List<String> group(String text) {
        List<String> lines = CodeLines.nonBlankLines(text);
        if (lines.isEmpty()) {
            return List.of();
        }

        List<String> blocks = new ArrayList<>();
        Deque<Integer> indentStack = new ArrayDeque<>();
        indentStack.push(0);
        StringBuilder block = new StringBuilder();
        int blockIndent = 0;

        for (int lineIndex = 0; lineIndex < lines.size(); lineIndex++) {
            String line = lines.get(lineIndex);
            int indent = CodeLines.indentOf(line);
            String trimmed = line.strip();

            if (CodeLines.isImportStatement(line)) {
                flush(block, blocks);
                blocks.add(trimmed);
                blockIndent = indent;
                continue;
            }

            if (indent < indentStack.peek()) {
                while (indentStack.size() > 1 && indent < indentStack.peek()) {
                    indentStack.pop();
                }
                if (block.length() > 0 && blockIndent >= indentStack.peek()) {
                    flush(block, blocks);
                }
                blockIndent = indent;
            } else if (indent > indentStack.peek()) {
                indentStack.push(indent);
                blockIndent = indent;
            }

            if (CodeLines.isBlockHeader(trimmed)) {
                flush(block, blocks);
                block.append(trimmed);
                blockIndent = indent;
                if (indentStack.peek() < indent) {
                    indentStack.push(indent);
                }
                continue;
            }

            if (block.length() > 0) {
                block.append(' ').append(trimmed);
            } else {
                block.append(trimmed);
                blockIndent = indent;
            }

            if (lineIndex + 1 < lines.size()) {
                String next = lines.get(lineIndex + 1);
                if (CodeLines.indentOf(next) <= blockIndent && !CodeLines.isBlockHeader(next.strip())) {
                    flush(block, blocks);
                }
            }
        }
        flush(block, blocks);

        return blocks.isEmpty() ? lines.stream().map(String::strip).toList() : blocks;
    }

    private static void flush(StringBuilder block, List<String> blocks) {
        String content = block.toString().strip();
        if (!content.isEmpty()) {
            blocks.add(content);
        }
        block.setLength(0);
    }
}
