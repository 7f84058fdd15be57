package recursum.processors;

public interface Processor {
    void run();
}
