package ai.flowrisk.analyzer;

/** Identifies a function within one analysis run: the file's position in the run and the function's position in it. */
public record FunctionId(int fileIndex, int localIndex) implements Comparable<FunctionId> {
    @Override
    public int compareTo(FunctionId o) {
        int cmp = Integer.compare(fileIndex, o.fileIndex);
        return cmp != 0 ? cmp : Integer.compare(localIndex, o.localIndex);
    }

    @Override
    public String toString() {
        return fileIndex + ":" + localIndex;
    }
}
