package yamlquill.yamlpath;

import yamlquill.document.DocNode;
import yamlquill.document.DocTree;
import yamlquill.document.DocValue.ObjectValue;
import yamlquill.document.DocValue.Sequence;
import yamlquill.document.NodePath;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Walks a parsed query over a [DocTree], one segment at a time.
///
/// The working set is a list of candidates. Each segment maps every candidate
/// to zero or more new ones, so result order follows document order within
/// each step. Matches are reported as paths because editor operations act on
/// locations.
final class YamlPathEvaluator {

    private static final Logger LOG = Logger.getLogger(YamlPathEvaluator.class.getName());

    private YamlPathEvaluator() {}

    private record Candidate(NodePath path, DocNode node) {}

    static List<NodePath> evaluate(YamlPathAst.Query query, DocTree tree) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(tree, "tree must not be null");

        final var root = new Candidate(NodePath.root(), tree.root());
        List<Candidate> candidates = List.of(root);

        for (final var segment : query.segments()) {
            if (segment instanceof YamlPathAst.Root) {
                candidates = List.of(root);
                continue;
            }
            final var next = new ArrayList<Candidate>();
            for (final var candidate : candidates) {
                apply(segment, candidate, next);
            }
            candidates = next;
            LOG.finer(() -> "After " + segment + ": " + next.size() + " candidates");
        }

        final var matches = new ArrayList<NodePath>(candidates.size());
        for (final var candidate : candidates) {
            matches.add(candidate.path());
        }
        return matches;
    }

    private static void apply(YamlPathAst.Segment segment, Candidate candidate, List<Candidate> out) {
        if (segment instanceof YamlPathAst.Current) {
            out.add(candidate);
        } else if (segment instanceof YamlPathAst.Child child) {
            child(child.name(), candidate, out);
        } else if (segment instanceof YamlPathAst.Index index) {
            index(index.index(), candidate, out);
        } else if (segment instanceof YamlPathAst.Wildcard) {
            children(candidate, out);
        } else if (segment instanceof YamlPathAst.Slice slice) {
            slice(slice, candidate, out);
        } else if (segment instanceof YamlPathAst.RecursiveDescent descent) {
            descend(descent.name(), candidate, out);
        } else if (segment instanceof YamlPathAst.MultiProperty multi) {
            for (final var name : multi.names()) {
                child(name, candidate, out);
            }
        } else {
            throw new IllegalStateException("Unhandled segment: " + segment);
        }
    }

    private static void child(String name, Candidate candidate, List<Candidate> out) {
        if (candidate.node().value() instanceof ObjectValue object) {
            final int i = object.indexOf(name);
            if (i >= 0) {
                out.add(new Candidate(candidate.path().child(i), object.member(i).node()));
            }
        }
    }

    private static void index(int index, Candidate candidate, List<Candidate> out) {
        if (candidate.node().value() instanceof Sequence sequence) {
            final int size = sequence.size();
            final int resolved = index < 0 ? size + index : index;
            if (resolved >= 0 && resolved < size) {
                out.add(new Candidate(candidate.path().child(resolved), sequence.element(resolved)));
            }
        }
    }

    private static void slice(YamlPathAst.Slice slice, Candidate candidate, List<Candidate> out) {
        if (candidate.node().value() instanceof Sequence sequence) {
            final int size = sequence.size();
            final int start = clamp(slice.start(), 0, size);
            final int end = clamp(slice.end(), size, size);
            for (int i = start; i < end; i++) {
                out.add(new Candidate(candidate.path().child(i), sequence.element(i)));
            }
        }
    }

    private static int clamp(Integer bound, int fallback, int size) {
        if (bound == null) {
            return fallback;
        }
        if (bound < 0) {
            return Math.max(size + bound, 0);
        }
        return Math.min(bound, size);
    }

    private static void children(Candidate candidate, List<Candidate> out) {
        final var value = candidate.node().value();
        if (value instanceof ObjectValue object) {
            for (int i = 0; i < object.size(); i++) {
                out.add(new Candidate(candidate.path().child(i), object.member(i).node()));
            }
        } else if (value instanceof Sequence sequence) {
            for (int i = 0; i < sequence.size(); i++) {
                out.add(new Candidate(candidate.path().child(i), sequence.element(i)));
            }
        }
    }

    /// Pre-order walk below `candidate`. The candidate itself is never a match.
    /// With a null name every descendant matches; otherwise only object members with that key.
    private static void descend(String name, Candidate candidate, List<Candidate> out) {
        final var value = candidate.node().value();
        if (value instanceof ObjectValue object) {
            for (int i = 0; i < object.size(); i++) {
                final var member = object.member(i);
                final var child = new Candidate(candidate.path().child(i), member.node());
                if (name == null || name.equals(member.key())) {
                    out.add(child);
                }
                descend(name, child, out);
            }
        } else if (value instanceof Sequence sequence) {
            for (int i = 0; i < sequence.size(); i++) {
                final var child = new Candidate(candidate.path().child(i), sequence.element(i));
                if (name == null) {
                    out.add(child);
                }
                descend(name, child, out);
            }
        }
    }
}
