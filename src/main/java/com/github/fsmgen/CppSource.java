package com.github.fsmgen;

import java.util.regex.Pattern;

import com.github.fsmgen.FsmGenException.Code;

/**
 * Small text helpers shared by every emitter: banner comment, include guards and the names that
 * generated code derives from node ids.
 */
final class CppSource {
  static final String runtimeHeaderName = "tinyfsm.hpp";

  private static final Pattern nodeIdFragment = Pattern.compile("[A-Za-z0-9_]+");

  static String headerComment() {
    return "/* auto-generated by fsm-gen */\n";
  }

  static String startGuard(final String guard) {
    return "#ifndef " + guard + "\n#define " + guard + "\n";
  }

  static String endGuard(final String guard) {
    return "#endif /* " + guard + " */\n";
  }

  static String include(final String header) {
    return "#include \"" + header + "\"\n";
  }

  /**
   * Name of the user supplied behavior hook of a node: state_&lt;id&gt;.
   */
  static String hookName(final GraphNode node) {
    return "state_" + node.getId();
  }

  static String hookPrototype(final GraphNode node) {
    return "void " + hookName(node) + "(void)";
  }

  /**
   * Node ids end up inside C++ identifiers, so they must be made of word characters only.
   */
  static void checkNodeId(final GraphNode node) throws FsmGenException {
    if (!nodeIdFragment.matcher(node.getId()).matches()) {
      throw new FsmGenException(Code.INVALID_NODE_ID,
          "Invalid state id: " + node.getId() + " (label " + node.getLabel() + ")");
    }
  }

  /**
   * Labels are copied into block comments; keep them from closing the comment early.
   */
  static String commentSafe(final String text) {
    return text.replace("*/", "* /").replace('\n', ' ');
  }

  private CppSource() {}
}
