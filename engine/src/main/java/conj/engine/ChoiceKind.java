package conj.engine;

/** The closed set of primitive draw kinds */
public enum ChoiceKind {
  INTEGER,
  BOOLEAN,
  FLOAT,
  STRING,
  BYTES
}
