package dev.mirror.controller;

import dev.mirror.controller.channel.ChannelSettings;
import dev.mirror.controller.channel.WorkerChannel;
import dev.mirror.controller.relay.BackgroundFetchService;
import dev.mirror.controller.relay.ContentScriptBridge;
import dev.mirror.controller.relay.DirectNetworkProxy;
import dev.mirror.controller.relay.ExtensionRelayProxy;
import dev.mirror.controller.relay.PageMessageBus;
import dev.mirror.controller.relay.PrivilegedNetworkProxy;
import dev.mirror.transport.MirrorException;
import dev.mirror.transport.message.SyncStats;
import dev.mirror.transport.message.TreeNode;
import dev.mirror.transport.relay.JdkHttpFetcher;
import dev.mirror.transport.relay.NetworkFetcher;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public final class Main {

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        boolean extension = arguments.remove("--extension");
        boolean useProxy = arguments.remove("--proxy");
        String host = option(arguments, "--host=", "localhost");
        int port = Integer.parseInt(option(arguments, "--port=", "7071"));
        if (arguments.isEmpty()) {
            printUsage();
            return;
        }
        String command = arguments.remove(0);

        ExecutorService executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "controller-relay");
            t.setDaemon(true);
            return t;
        });
        NetworkFetcher fetcher = new JdkHttpFetcher(Duration.ofSeconds(10), Duration.ofSeconds(60));
        PrivilegedNetworkProxy proxy;
        if (extension) {
            PageMessageBus bus = new PageMessageBus(executor);
            new ContentScriptBridge(bus, new BackgroundFetchService(fetcher, executor)).install();
            proxy = new ExtensionRelayProxy(bus);
        } else {
            proxy = new DirectNetworkProxy(fetcher, executor);
        }

        try (MirrorClient client = new MirrorClient(WorkerChannel.connect(host, port, ChannelSettings.defaults(), proxy))) {
            client.init().join();
            switch (command) {
                case "clone" -> handleClone(client, arguments, useProxy);
                case "pull" -> handlePull(client, arguments, useProxy);
                case "tree" -> printTree(client.getFileTree().join(), "");
                case "read" -> handleRead(client, arguments);
                case "sync" -> handleSync(client, arguments);
                case "wipe" -> {
                    client.resetApp().join();
                    System.out.println("OK: content store wiped");
                }
                default -> {
                    System.err.println("Unknown command: " + command);
                    printUsage();
                }
            }
        } catch (CompletionException e) {
            System.err.println("ERROR: " + MirrorException.unwrap(e).getMessage());
            System.exit(1);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void handleClone(MirrorClient client, List<String> arguments, boolean useProxy) {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("clone requires a repository url");
        }
        GitUrls.GitUrl target = GitUrls.parse(arguments.get(0));
        String ref = arguments.size() > 1 ? arguments.get(1) : target.branch();
        client.clone(target.url(), ref, useProxy, line -> System.out.println("  " + line)).join();
        System.out.println("OK: cloned " + target.url());
    }

    private static void handlePull(MirrorClient client, List<String> arguments, boolean useProxy) {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("pull requires a repository url");
        }
        GitUrls.GitUrl target = GitUrls.parse(arguments.get(0));
        String ref = arguments.size() > 1 ? arguments.get(1) : target.branch();
        client.pull(target.url(), ref, useProxy, line -> System.out.println("  " + line)).join();
        System.out.println("OK: pulled " + target.url());
    }

    private static void handleRead(MirrorClient client, List<String> arguments) {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("read requires a path argument");
        }
        System.out.println(client.readFile(arguments.get(0)).join());
    }

    private static void handleSync(MirrorClient client, List<String> arguments) {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("sync requires a local directory");
        }
        client.useLocalDirectory(Path.of(arguments.get(0))).join();
        String path = arguments.size() > 1 ? arguments.get(1) : MirrorClient.REPOSITORY_DIR;
        SyncStats stats = client.syncToLocal(path, progress ->
            System.out.printf("  [%3d%%] %s%n", progress.percent(), progress.path())).join();
        System.out.println("OK: " + stats.summaryLine());
    }

    private static void printTree(List<TreeNode> nodes, String indent) {
        for (TreeNode node : nodes) {
            System.out.println(indent + node.name() + (node.isDirectory() ? "/" : ""));
            if (node.isDirectory() && node.children() != null) {
                printTree(node.children(), indent + "  ");
            }
        }
    }

    private static String option(List<String> arguments, String prefix, String defaultValue) {
        for (String argument : arguments) {
            if (argument.startsWith(prefix)) {
                arguments.remove(argument);
                return argument.substring(prefix.length());
            }
        }
        return defaultValue;
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar repo-mirror-controller.jar [--host=localhost] [--port=7071] [--extension] [--proxy] <command> [args]\n" +
            "Commands:\n" +
            "  clone <url> [ref]\n" +
            "  pull <url> [ref]\n" +
            "  tree\n" +
            "  read <path>\n" +
            "  sync <local-dir> [path]\n" +
            "  wipe");
    }
}
