package io.verdict.core;

import io.verdict.core.tree.Choice;
import io.verdict.core.tree.DecisionNode;
import io.verdict.core.tree.DecisionTree;
import io.verdict.core.tree.NodeType;
import io.verdict.core.tree.Rule;
import io.verdict.core.tree.RuleOperator;
import java.util.List;

/// Shared trees and node factories for core tests.
public final class TreeFixtures {

    private TreeFixtures() {}

    public static DecisionNode end(String id, String prompt) {
        return DecisionNode.builder().id(id).type(NodeType.END).prompt(prompt).build();
    }

    public static DecisionNode text(String id, String prompt, String next) {
        return DecisionNode.builder()
                .id(id)
                .type(NodeType.TEXT)
                .prompt(prompt)
                .defaultNextNodeId(next)
                .build();
    }

    public static DecisionNode singleChoice(
            String id, String prompt, String defaultNext, Choice... choices) {
        return DecisionNode.builder()
                .id(id)
                .type(NodeType.SINGLE_CHOICE)
                .prompt(prompt)
                .choices(List.of(choices))
                .defaultNextNodeId(defaultNext)
                .build();
    }

    public static DecisionNode number(String id, String prompt, String defaultNext, Rule... rules) {
        return DecisionNode.builder()
                .id(id)
                .type(NodeType.NUMBER)
                .prompt(prompt)
                .rules(List.of(rules))
                .defaultNextNodeId(defaultNext)
                .build();
    }

    public static DecisionTree tree(String id, String startNodeId, DecisionNode... nodes) {
        DecisionTree.Builder builder =
                DecisionTree.builder().id(id).version("1.0").startNodeId(startNodeId);
        for (DecisionNode node : nodes) {
            builder.node(node);
        }
        return builder.build();
    }

    /// Support triage: issue category, then amount or description.
    ///
    /// ```
    /// q_issue ──billing──> q_billing ──<100──> end_refund
    ///    │                     └─────>=100──> end_escalate
    ///    ├──technical──> q_technical ──> end_ticket
    ///    └──default──> end_other
    /// ```
    public static DecisionTree billingTree() {
        return tree(
                "support-triage",
                "q_issue",
                singleChoice(
                        "q_issue",
                        "What is the issue about?",
                        "end_other",
                        new Choice("billing", "Billing issue", "q_billing"),
                        new Choice("technical", "Technical problem", "q_technical")),
                number(
                        "q_billing",
                        "How much were you charged?",
                        "end_other",
                        Rule.of(RuleOperator.LESS_THAN, "100", "end_refund"),
                        Rule.of(RuleOperator.GREATER_OR_EQUAL, "100", "end_escalate")),
                text("q_technical", "Describe the problem", "end_ticket"),
                end("end_refund", "Refund issued"),
                end("end_escalate", "Escalated to billing team"),
                end("end_ticket", "Ticket opened"),
                end("end_other", "Routed to general support"));
    }

    /// Single yes/no question with two outcomes.
    public static DecisionTree approvalTree() {
        return tree(
                "approval",
                "start",
                singleChoice(
                        "start",
                        "Do you approve?",
                        null,
                        Choice.of("yes", "end_yes"),
                        Choice.of("no", "end_no")),
                end("end_yes", "Approved"),
                end("end_no", "Rejected"));
    }
}
