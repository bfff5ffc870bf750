package max.quorum;

import max.quorum.engine.console.ConsoleEngine;
import max.quorum.engine.console.ConsoleEngineImpl;
import max.quorum.engine.console.ConsoleServer;

public class Main {
    public static void main(String[] args) {
        ConsoleEngine engine;
        try {
            engine = new ConsoleEngineImpl();
        } catch (IllegalArgumentException e) {
            // bad -Dquorum.* value
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(2);
            return;
        }
        new ConsoleServer("Quorum", engine).run();
    }
}
