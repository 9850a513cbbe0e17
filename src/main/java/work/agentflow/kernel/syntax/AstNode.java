package work.agentflow.kernel.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Workflow syntax tree. Nodes are immutable once built.
 */
public interface AstNode {

    record Sequence(List<AstNode> steps) implements AstNode {
        public Sequence {
            steps = List.copyOf(steps);
        }
    }

    record Parallel(List<AstNode> branches) implements AstNode {
        public Parallel {
            branches = List.copyOf(branches);
        }
    }

    record Conditional(AstNode source, String conditionText, AstNode target) implements AstNode {
        public Conditional {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(conditionText, "conditionText");
            Objects.requireNonNull(target, "target");
        }
    }

    record Step(String name, String instruction, String capture, int position) implements AstNode {
        public Step {
            Objects.requireNonNull(name, "name");
        }

        /**
         * A bare name is a candidate back-reference to an earlier step of the same name.
         */
        public boolean isBare() {
            return instruction == null && capture == null;
        }
    }

    record Checkpoint(String label, int position) implements AstNode {
        public Checkpoint {
            Objects.requireNonNull(label, "label");
        }
    }

    record Subgraph(AstNode child) implements AstNode {
        public Subgraph {
            Objects.requireNonNull(child, "child");
        }
    }
}
