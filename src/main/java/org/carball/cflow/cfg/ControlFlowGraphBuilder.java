package org.carball.cflow.cfg;

import lombok.extern.slf4j.Slf4j;
import org.carball.cflow.model.function.FunctionUnit;
import org.carball.cflow.model.token.Token;
import org.carball.cflow.model.token.TokenKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link ControlFlowGraph} from a function body in one recursive-descent pass.
 * <p>
 * Nesting depth travels down the descent as a parameter and the deepest depth reached
 * comes back as the return value, so a builder can be shared between worker threads.
 * Every non-exit block ends with exactly one outgoing control edge unless it is a
 * decision block, which keeps {@code edges - blocks + 2} equal to the number of
 * decision points plus one.
 */
@Slf4j
public class ControlFlowGraphBuilder {

    public static final int DEFAULT_MAX_NESTING = 256;

    private final boolean countBooleanOperators;
    private final int maxNesting;

    public ControlFlowGraphBuilder() {
        this(false, DEFAULT_MAX_NESTING);
    }

    /**
     * @param countBooleanOperators split {@code &&} / {@code ||} conditions into one decision per operand
     * @param maxNesting            deepest nesting tolerated before the body is rejected as malformed
     */
    public ControlFlowGraphBuilder(boolean countBooleanOperators, int maxNesting) {
        if (maxNesting < 1) {
            throw new IllegalArgumentException("maxNesting must be positive: " + maxNesting);
        }
        this.countBooleanOperators = countBooleanOperators;
        this.maxNesting = maxNesting;
    }

    public ControlFlowGraph build(FunctionUnit unit) throws MalformedControlFlowException {
        ControlFlowGraph graph = new Pass(unit).run();
        log.debug("Built CFG for {}: {} blocks, {} edges, {} decision points",
                graph.getFunctionName(), graph.getBlocks().size(), graph.getEdges().size(),
                graph.getDecisionPoints());
        return graph;
    }

    private final class Pass {

        private final FunctionUnit unit;
        private final List<Token> tokens;
        private final List<BasicBlock> blocks = new ArrayList<>();
        private final List<Edge> edges = new ArrayList<>();
        private final Deque<JumpTarget> targets = new ArrayDeque<>();
        private final Set<Integer> callers = new HashSet<>();
        private final BasicBlock entry;
        private final BasicBlock exit;

        // null once the current path has been terminated by return/break/continue
        private BasicBlock current;
        private int pos;
        private int braceLevel;
        private int decisionPoints;
        private boolean recursive;

        private Pass(FunctionUnit unit) {
            this.unit = unit;
            this.tokens = unit.body();
            this.entry = newBlock(BlockKind.ENTRY);
            this.exit = newBlock(BlockKind.EXIT);
            this.current = entry;
        }

        ControlFlowGraph run() throws MalformedControlFlowException {
            int maxDepth = 0;
            while (!atEnd()) {
                if (peek().isPunctuation("}")) {
                    throw malformed(peek(), "unmatched '}'");
                }
                maxDepth = Math.max(maxDepth, statement(0));
            }
            if (current != null) {
                link(current, exit, EdgeKind.FALLTHROUGH);
            }
            return new ControlFlowGraph(unit.qualifiedName(), entry.getId(), exit.getId(),
                    blocks, edges, maxDepth, decisionPoints, recursive);
        }

        /**
         * Parses one statement and returns the deepest nesting reached inside it.
         */
        private int statement(int depth) throws MalformedControlFlowException {
            if (atEnd()) {
                throw malformed(null, "unexpected end of function body");
            }
            Token token = peek();
            if (token.isPunctuation("{")) {
                return compound(depth);
            }
            if (token.isPunctuation("}")) {
                throw malformed(token, "expected a statement before '}'");
            }
            if (token.isPunctuation(";")) {
                pos++;
                return depth;
            }
            if (isLabel()) {
                // goto target: kept as a plain fragment, the labelled statement follows
                while (isLabel()) {
                    currentBlock().addStatement(next().text() + " :");
                    pos++;
                }
                if (atEnd() || peek().isPunctuation("}")) {
                    return depth;
                }
                return statement(depth);
            }
            if (token.kind() == TokenKind.KEYWORD) {
                switch (token.text()) {
                    case "if":
                        return ifStatement(depth);
                    case "while":
                        return whileStatement(depth);
                    case "for":
                        return forStatement(depth);
                    case "do":
                        return doStatement(depth);
                    case "switch":
                        return switchStatement(depth);
                    case "return":
                    case "throw":
                        exitStatement();
                        return depth;
                    case "break":
                    case "continue":
                        jumpStatement();
                        return depth;
                    case "try":
                        return tryStatement(depth);
                    case "else":
                        throw malformed(token, "'else' without matching 'if'");
                    case "case":
                    case "default":
                        throw malformed(token, "'" + token.text() + "' label outside of switch");
                    case "catch":
                        throw malformed(token, "'catch' without matching 'try'");
                    default:
                        break;
                }
            }
            simpleStatement();
            return depth;
        }

        private int compound(int depth) throws MalformedControlFlowException {
            Token open = next();
            if (++braceLevel > maxNesting) {
                throw malformed(open, "block nesting exceeds limit of " + maxNesting);
            }
            int max = depth;
            while (true) {
                if (atEnd()) {
                    throw malformed(open, "unmatched '{'");
                }
                if (peek().isPunctuation("}")) {
                    pos++;
                    braceLevel--;
                    return max;
                }
                max = Math.max(max, statement(depth));
            }
        }

        private void simpleStatement() throws MalformedControlFlowException {
            List<Token> fragment = scanStatement();
            BasicBlock block = currentBlock();
            block.addStatement(render(fragment));
            noteSelfCalls(fragment, block);
        }

        /**
         * An {@code else if} chain is walked in a loop rather than by recursion, so chain
         * length is not limited by the stack. Merges are folded from the innermost link
         * outwards, as if each {@code else if} were a nested statement.
         */
        private int ifStatement(int depth) throws MalformedControlFlowException {
            Token keyword = next();
            int inner = nested(depth, keyword);
            int max = inner;
            // null entries mark then-branches that ended in a jump or return
            List<BasicBlock> thenEnds = new ArrayList<>();
            BasicBlock tail;

            while (true) {
                if (!atEnd() && peek().isKeyword("constexpr")) {
                    pos++;
                }
                List<Token> condition = parenthesized(keyword);

                Decision decision = decide(condition, conditionBlock(BlockKind.CONDITION));
                BasicBlock thenBlock = newBlock(BlockKind.NORMAL);
                decision.linkTrue(thenBlock, EdgeKind.TRUE);
                current = thenBlock;
                max = Math.max(max, statement(inner));
                BasicBlock thenEnd = current;

                if (atEnd() || !peek().isKeyword("else")) {
                    tail = newBlock(BlockKind.MERGE);
                    decision.linkFalse(tail);
                    if (thenEnd != null) {
                        link(thenEnd, tail, EdgeKind.FALLTHROUGH);
                    }
                    break;
                }
                pos++;
                BasicBlock elseBlock = newBlock(BlockKind.NORMAL);
                decision.linkFalse(elseBlock);
                current = elseBlock;
                thenEnds.add(thenEnd);

                // "else if" stays at the depth of the first if
                if (!atEnd() && peek().isKeyword("if")) {
                    keyword = next();
                    continue;
                }
                max = Math.max(max, statement(inner));
                tail = merge(thenEnds.remove(thenEnds.size() - 1), current);
                break;
            }

            for (int k = thenEnds.size() - 1; k >= 0; k--) {
                tail = merge(thenEnds.get(k), tail);
            }
            current = tail;
            return max;
        }

        private int whileStatement(int depth) throws MalformedControlFlowException {
            Token keyword = next();
            List<Token> condition = parenthesized(keyword);
            int inner = nested(depth, keyword);

            BasicBlock header = conditionBlock(BlockKind.LOOP_HEADER);
            Decision decision = decide(condition, header);
            BasicBlock body = newBlock(BlockKind.NORMAL);
            decision.linkTrue(body, EdgeKind.TRUE);

            JumpTarget target = new JumpTarget(true, header);
            int max = loopBody(target, body, inner);
            if (current != null) {
                link(current, header, EdgeKind.LOOP_BACK);
            }
            BasicBlock after = target.exit();
            decision.linkFalse(after);
            current = after;
            return max;
        }

        private int forStatement(int depth) throws MalformedControlFlowException {
            Token keyword = next();
            List<Token> header = parenthesized(keyword);
            int inner = nested(depth, keyword);

            List<List<Token>> clauses = splitTopLevel(header, ";");
            List<Token> init = List.of();
            List<Token> condition = header;
            List<Token> update = List.of();
            if (clauses.size() >= 3) {
                init = clauses.get(0);
                condition = clauses.get(1);
                update = clauses.get(2);
            }
            if (!init.isEmpty()) {
                BasicBlock block = currentBlock();
                block.addStatement(render(init));
                noteSelfCalls(init, block);
            }

            BasicBlock loopHeader = conditionBlock(BlockKind.LOOP_HEADER);
            Decision decision = decide(condition, loopHeader);
            BasicBlock body = newBlock(BlockKind.NORMAL);
            decision.linkTrue(body, EdgeKind.TRUE);

            // continue runs the update clause, so it resumes at a separate step block
            JumpTarget target = update.isEmpty()
                    ? new JumpTarget(true, loopHeader)
                    : new JumpTarget(true, null, BlockKind.NORMAL);
            int max = loopBody(target, body, inner);
            BasicBlock step = target.resumeIfCreated();
            if (step != null && step != loopHeader) {
                if (current != null) {
                    link(current, step, EdgeKind.FALLTHROUGH);
                }
                current = step;
            }
            if (current != null) {
                if (!update.isEmpty()) {
                    current.addStatement(render(update));
                    noteSelfCalls(update, current);
                }
                link(current, loopHeader, EdgeKind.LOOP_BACK);
            }
            BasicBlock after = target.exit();
            decision.linkFalse(after);
            current = after;
            return max;
        }

        private int doStatement(int depth) throws MalformedControlFlowException {
            Token keyword = next();
            int inner = nested(depth, keyword);

            BasicBlock body = newBlock(BlockKind.NORMAL);
            link(currentBlock(), body, EdgeKind.FALLTHROUGH);

            JumpTarget target = new JumpTarget(true, null);
            int max = loopBody(target, body, inner);

            if (atEnd() || !peek().isKeyword("while")) {
                throw malformed(keyword, "'do' without matching 'while'");
            }
            Token whileKeyword = next();
            List<Token> condition = parenthesized(whileKeyword);
            if (!atEnd() && peek().isPunctuation(";")) {
                pos++;
            }

            BasicBlock conditionBlock = target.resume();
            if (current != null) {
                link(current, conditionBlock, EdgeKind.FALLTHROUGH);
            }
            Decision decision = decide(condition, conditionBlock);
            decision.linkTrue(body, EdgeKind.LOOP_BACK);
            BasicBlock after = target.exit();
            decision.linkFalse(after);
            current = after;
            return max;
        }

        private int switchStatement(int depth) throws MalformedControlFlowException {
            Token keyword = next();
            List<Token> selector = parenthesized(keyword);
            int inner = nested(depth, keyword);

            BasicBlock switchBlock = conditionBlock(BlockKind.SWITCH);
            switchBlock.addStatement("switch (" + render(selector) + ")");
            noteSelfCalls(selector, switchBlock);

            if (atEnd() || !peek().isPunctuation("{")) {
                throw malformed(keyword, "expected '{' after switch");
            }
            Token open = next();

            JumpTarget target = new JumpTarget(false, null);
            targets.push(target);
            current = null;
            boolean hasDefault = false;
            int max = inner;
            try {
                while (true) {
                    if (atEnd()) {
                        throw malformed(open, "unterminated switch body");
                    }
                    Token token = peek();
                    if (token.isPunctuation("}")) {
                        pos++;
                        break;
                    }
                    if (token.isKeyword("case") || token.isKeyword("default")) {
                        pos++;
                        List<Token> label = caseLabel(token);
                        if (token.isKeyword("case")) {
                            decisionPoints++;
                        } else {
                            hasDefault = true;
                        }
                        BasicBlock caseBlock = newBlock(BlockKind.NORMAL);
                        caseBlock.addStatement(label.isEmpty() ? token.text() : token.text() + " " + render(label));
                        link(switchBlock, caseBlock, EdgeKind.CASE);
                        if (current != null) {
                            link(current, caseBlock, EdgeKind.FALLTHROUGH);
                        }
                        current = caseBlock;
                        continue;
                    }
                    max = Math.max(max, statement(inner));
                }
            } finally {
                targets.pop();
            }

            if (!hasDefault) {
                link(switchBlock, target.exit(), EdgeKind.FALSE);
            }
            if (current != null) {
                link(current, target.exit(), EdgeKind.FALLTHROUGH);
            }
            current = target.exitIfCreated();
            return max;
        }

        private int tryStatement(int depth) throws MalformedControlFlowException {
            pos++;
            int max = statement(depth);
            while (!atEnd() && peek().isKeyword("catch")) {
                Token keyword = next();
                parenthesized(keyword);
                max = Math.max(max, statement(depth));
            }
            return max;
        }

        private void exitStatement() throws MalformedControlFlowException {
            List<Token> fragment = scanStatement();
            BasicBlock block = currentBlock();
            block.addStatement(render(fragment));
            noteSelfCalls(fragment, block);
            block.markTerminal();
            link(block, exit, EdgeKind.RETURN);
            current = null;
        }

        private void jumpStatement() throws MalformedControlFlowException {
            Token keyword = peek();
            boolean isBreak = keyword.isKeyword("break");
            List<Token> fragment = scanStatement();

            JumpTarget target = null;
            for (JumpTarget candidate : targets) {
                if (isBreak || candidate.loop) {
                    target = candidate;
                    break;
                }
            }
            if (target == null) {
                throw malformed(keyword, isBreak
                        ? "'break' outside of loop or switch"
                        : "'continue' outside of loop");
            }

            BasicBlock block = currentBlock();
            block.addStatement(render(fragment));
            link(block, isBreak ? target.exit() : target.resume(), EdgeKind.JUMP);
            current = null;
        }

        private int loopBody(JumpTarget target, BasicBlock body, int inner) throws MalformedControlFlowException {
            targets.push(target);
            current = body;
            try {
                return Math.max(inner, statement(inner));
            } finally {
                targets.pop();
            }
        }

        /**
         * Places a condition. The current block is reused when it is still empty,
         * except for the entry block, which stays a plain entry point.
         */
        private BasicBlock conditionBlock(BlockKind kind) {
            BasicBlock block = currentBlock();
            if (block.isEmpty() && block != entry) {
                block.setKind(kind);
                return block;
            }
            BasicBlock fresh = newBlock(kind);
            link(block, fresh, EdgeKind.FALLTHROUGH);
            return fresh;
        }

        private Decision decide(List<Token> condition, BasicBlock first) {
            List<List<Token>> operands = new ArrayList<>();
            List<String> operators = new ArrayList<>();
            if (countBooleanOperators) {
                splitShortCircuit(condition, operands, operators);
            } else {
                operands.add(condition);
            }

            Decision decision = new Decision();
            BasicBlock block = first;
            for (int k = 0; k < operands.size(); k++) {
                List<Token> operand = operands.get(k);
                if (!operand.isEmpty()) {
                    block.addStatement(render(operand));
                    noteSelfCalls(operand, block);
                }
                decisionPoints++;

                if (k == operands.size() - 1) {
                    decision.whenTrue.add(block);
                    decision.whenFalse.add(block);
                } else {
                    BasicBlock next = newBlock(BlockKind.CONDITION);
                    if ("||".equals(operators.get(k))) {
                        decision.whenTrue.add(block);
                        link(block, next, EdgeKind.FALSE);
                    } else {
                        decision.whenFalse.add(block);
                        link(block, next, EdgeKind.TRUE);
                    }
                    block = next;
                }
            }
            return decision;
        }

        private void splitShortCircuit(List<Token> condition, List<List<Token>> operands, List<String> operators) {
            int depth = 0;
            int start = 0;
            for (int k = 0; k < condition.size(); k++) {
                Token t = condition.get(k);
                if (t.isPunctuation("(") || t.isPunctuation("[")) {
                    depth++;
                } else if (t.isPunctuation(")") || t.isPunctuation("]")) {
                    depth--;
                } else if (depth == 0 && (t.isPunctuation("&&") || t.isPunctuation("||"))) {
                    operands.add(condition.subList(start, k));
                    operators.add(t.text());
                    start = k + 1;
                }
            }
            operands.add(condition.subList(start, condition.size()));
        }

        private List<Token> caseLabel(Token keyword) throws MalformedControlFlowException {
            int start = pos;
            int depth = 0;
            while (!atEnd()) {
                Token t = peek();
                if (t.isPunctuation("(")) {
                    depth++;
                } else if (t.isPunctuation(")")) {
                    depth--;
                } else if (depth == 0 && t.isPunctuation(":")) {
                    List<Token> label = tokens.subList(start, pos);
                    pos++;
                    return label;
                }
                pos++;
            }
            throw malformed(keyword, "'" + keyword.text() + "' label without ':'");
        }

        /**
         * Consumes tokens up to and including the terminating {@code ;}. Braces inside the
         * statement (initialiser lists, lambdas) are absorbed; a missing {@code ;} before
         * a closing brace is tolerated.
         */
        private List<Token> scanStatement() throws MalformedControlFlowException {
            int start = pos;
            int parens = 0;
            int end = -1;
            while (!atEnd()) {
                Token t = peek();
                if (t.isPunctuation("(") || t.isPunctuation("[")) {
                    parens++;
                } else if (t.isPunctuation(")") || t.isPunctuation("]")) {
                    if (parens == 0) {
                        throw malformed(t, "unbalanced '" + t.text() + "'");
                    }
                    parens--;
                } else if (t.isPunctuation("{")) {
                    int close = matching(pos, "{", "}");
                    if (close < 0) {
                        throw malformed(t, "unmatched '{'");
                    }
                    pos = close + 1;
                    continue;
                } else if (t.isPunctuation("}") && parens == 0) {
                    end = pos;
                    break;
                } else if (t.isPunctuation(";") && parens == 0) {
                    end = pos;
                    pos++;
                    break;
                }
                pos++;
            }
            if (parens > 0) {
                throw malformed(tokens.get(start), "unbalanced '('");
            }
            return tokens.subList(start, end < 0 ? pos : end);
        }

        private List<Token> parenthesized(Token keyword) throws MalformedControlFlowException {
            if (atEnd() || !peek().isPunctuation("(")) {
                throw malformed(keyword, "expected '(' after '" + keyword.text() + "'");
            }
            int open = pos;
            int close = matching(open, "(", ")");
            if (close < 0) {
                throw malformed(peek(), "unmatched '('");
            }
            pos = close + 1;
            return tokens.subList(open + 1, close);
        }

        private int nested(int depth, Token keyword) throws MalformedControlFlowException {
            int inner = depth + 1;
            if (inner > maxNesting) {
                throw malformed(keyword, "nesting depth exceeds limit of " + maxNesting);
            }
            return inner;
        }

        private void noteSelfCalls(List<Token> fragment, BasicBlock block) {
            for (int k = 0; k + 1 < fragment.size(); k++) {
                Token t = fragment.get(k);
                if (!t.isIdentifier() || !t.is(unit.name()) || !fragment.get(k + 1).isPunctuation("(")) {
                    continue;
                }
                if (k > 0 && !isSelfReceiver(fragment, k)) {
                    continue;
                }
                recursive = true;
                if (callers.add(block.getId())) {
                    link(block, entry, EdgeKind.CALL);
                }
            }
        }

        private boolean isSelfReceiver(List<Token> fragment, int k) {
            Token previous = fragment.get(k - 1);
            if (previous.isPunctuation(".")) {
                return false;
            }
            if (previous.isPunctuation("->")) {
                return k >= 2 && fragment.get(k - 2).isKeyword("this");
            }
            if (previous.isPunctuation("::") && k >= 2 && fragment.get(k - 2).isIdentifier()) {
                String scope = unit.enclosingScope();
                String qualifier = fragment.get(k - 2).text();
                return scope.equals(qualifier) || scope.endsWith("::" + qualifier);
            }
            return true;
        }

        private BasicBlock merge(BasicBlock first, BasicBlock second) {
            if (first == null && second == null) {
                return null;
            }
            BasicBlock merge = newBlock(BlockKind.MERGE);
            if (first != null) {
                link(first, merge, EdgeKind.FALLTHROUGH);
            }
            if (second != null) {
                link(second, merge, EdgeKind.FALLTHROUGH);
            }
            return merge;
        }

        /**
         * The block the next statement goes into. After a terminator this opens a
         * new block without predecessors, which is how dead code shows up in the graph.
         */
        private BasicBlock currentBlock() {
            if (current == null) {
                current = newBlock(BlockKind.NORMAL);
            }
            return current;
        }

        private BasicBlock newBlock(BlockKind kind) {
            BasicBlock block = new BasicBlock(blocks.size(), kind);
            blocks.add(block);
            return block;
        }

        private void link(BasicBlock from, BasicBlock to, EdgeKind kind) {
            Edge edge = new Edge(from.getId(), to.getId(), kind);
            edges.add(edge);
            from.addOutgoing(edge);
        }

        private List<List<Token>> splitTopLevel(List<Token> list, String separator) {
            List<List<Token>> parts = new ArrayList<>();
            int depth = 0;
            int start = 0;
            for (int k = 0; k < list.size(); k++) {
                Token t = list.get(k);
                if (t.isPunctuation("(") || t.isPunctuation("[") || t.isPunctuation("{")) {
                    depth++;
                } else if (t.isPunctuation(")") || t.isPunctuation("]") || t.isPunctuation("}")) {
                    depth--;
                } else if (depth == 0 && t.isPunctuation(separator)) {
                    parts.add(list.subList(start, k));
                    start = k + 1;
                }
            }
            parts.add(list.subList(start, list.size()));
            return parts;
        }

        private int matching(int openIndex, String open, String close) {
            int depth = 0;
            for (int k = openIndex; k < tokens.size(); k++) {
                Token t = tokens.get(k);
                if (t.isPunctuation(open)) {
                    depth++;
                } else if (t.isPunctuation(close)) {
                    depth--;
                    if (depth == 0) {
                        return k;
                    }
                }
            }
            return -1;
        }

        private String render(List<Token> fragment) {
            return fragment.stream().map(Token::text).collect(Collectors.joining(" "));
        }

        private boolean isLabel() {
            return !atEnd() && peek().isIdentifier()
                    && pos + 1 < tokens.size() && tokens.get(pos + 1).isPunctuation(":");
        }

        private boolean atEnd() {
            return pos >= tokens.size();
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private Token next() {
            return tokens.get(pos++);
        }

        private MalformedControlFlowException malformed(Token at, String message) {
            int offset = at != null ? at.offset() : unit.offset();
            return new MalformedControlFlowException(unit.qualifiedName(), offset, message);
        }

        /**
         * Where {@code break} and {@code continue} go. Both blocks are created on first use
         * so that a loop or switch never leaves an orphan block behind. A {@code do} loop
         * resumes at its condition, a {@code for} loop with an update clause at its step block.
         */
        private final class JumpTarget {

            private final boolean loop;
            private final BlockKind resumeKind;
            private BasicBlock resume;
            private BasicBlock exit;

            private JumpTarget(boolean loop, BasicBlock resume) {
                this(loop, resume, BlockKind.CONDITION);
            }

            private JumpTarget(boolean loop, BasicBlock resume, BlockKind resumeKind) {
                this.loop = loop;
                this.resume = resume;
                this.resumeKind = resumeKind;
            }

            BasicBlock exit() {
                if (exit == null) {
                    exit = newBlock(BlockKind.NORMAL);
                }
                return exit;
            }

            BasicBlock exitIfCreated() {
                return exit;
            }

            BasicBlock resume() {
                if (resume == null) {
                    resume = newBlock(resumeKind);
                }
                return resume;
            }

            BasicBlock resumeIfCreated() {
                return resume;
            }
        }

        /**
         * Condition blocks still waiting for their true and false successors.
         */
        private final class Decision {

            private final List<BasicBlock> whenTrue = new ArrayList<>();
            private final List<BasicBlock> whenFalse = new ArrayList<>();

            void linkTrue(BasicBlock target, EdgeKind kind) {
                whenTrue.forEach(block -> link(block, target, kind));
            }

            void linkFalse(BasicBlock target) {
                whenFalse.forEach(block -> link(block, target, EdgeKind.FALSE));
            }
        }
    }
}
