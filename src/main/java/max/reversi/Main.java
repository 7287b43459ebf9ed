package max.reversi;

import max.reversi.console.ConsoleOptions;
import max.reversi.console.ConsoleServer;
import max.reversi.engine.game.Game;
import max.reversi.engine.search.SearchFacade;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Random;

public class Main {
    public static void main(String[] args) throws IOException {
        ConsoleOptions options;
        try {
            options = ConsoleOptions.parse(args, System.nanoTime());
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: --black=human|engine|random --white=... --depth=N --evaluator=pieces|edges --noise=N --seed=N --debug");
            System.exit(2);
            return;
        }

        System.err.println("Search configuration: " + options.searchConfig());
        PrintWriter out = new PrintWriter(new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)), true);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new ConsoleServer(in, out, options.black(), options.white(),
                new SearchFacade(options.searchConfig()), new Random(options.seed())).run(new Game());
    }
}
