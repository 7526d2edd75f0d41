package info.isaksson.erland.codeatlas.annotate;

/** A binding whose value could not be determined. Any use of it is unresolved. */
enum Unknown {
    VALUE
}
