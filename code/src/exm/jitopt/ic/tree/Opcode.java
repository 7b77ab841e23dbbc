package exm.jitopt.ic.tree;

public enum Opcode {
  // Bind result of expression to variable
  ASSIGN,

  // Control flow at end of block
  JUMP, BRANCH, RETURN,
}
