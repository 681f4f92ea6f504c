package com.framedenoiser.app;

import com.framedenoiser.core.queue.DenoiseQueueService;
import com.framedenoiser.core.queue.QueueTask;
import com.framedenoiser.core.video.DenoiseResult;
import com.framedenoiser.core.video.VideoDenoiser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

// точка входа: Boot <input...> [--out=path] [--fps=N] [--from=N] [--to=N] [--fourcc=XXXX]
public class Boot {
    private static final Logger log = LoggerFactory.getLogger(Boot.class);

    record Args(List<Path> inputs, Path out, Double fps, Integer from, Integer to, String fourcc) {}

    public static void main(String[] args) throws Exception {
        Args a;
        try {
            a = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("usage: Boot <input...> [--out=path] [--fps=N] [--from=N] [--to=N] [--fourcc=XXXX]");
            System.exit(2);
            return;
        }
        Config cfg = applyOverrides(Config.load(), a);
        int failed = run(cfg, a);
        System.exit(failed == 0 ? 0 : 1);
    }

    static Args parseArgs(String[] args) {
        List<Path> inputs = new ArrayList<>();
        Path out = null;
        Double fps = null;
        Integer from = null, to = null;
        String fourcc = null;
        for (String s : args) {
            if (s.startsWith("--out=")) out = Path.of(value(s));
            else if (s.startsWith("--fps=")) fps = Double.parseDouble(value(s));
            else if (s.startsWith("--from=")) from = Integer.parseInt(value(s));
            else if (s.startsWith("--to=")) to = Integer.parseInt(value(s));
            else if (s.startsWith("--fourcc=")) fourcc = value(s);
            else if (s.startsWith("--")) throw new IllegalArgumentException("unknown option: " + s);
            else inputs.add(Path.of(s));
        }
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("no input video given");
        }
        if (out != null && inputs.size() > 1) {
            throw new IllegalArgumentException("--out is allowed with a single input only");
        }
        return new Args(List.copyOf(inputs), out, fps, from, to, fourcc);
    }

    private static String value(String arg) {
        return arg.substring(arg.indexOf('=') + 1);
    }

    /** Параметры командной строки перекрывают секцию video из application.yaml. */
    static Config applyOverrides(Config cfg, Args a) {
        var v = cfg.video();
        var video = new Config.VideoConf(
                a.fourcc() != null ? a.fourcc() : v.fourcc(),
                a.fps() != null ? a.fps() : v.fps(),
                a.from() != null ? a.from() : v.fromFrame(),
                a.to() != null ? a.to() : v.toFrame(),
                v.writeOriginal(),
                v.outputSuffix());
        return new Config(cfg.denoise(), cfg.threads(), video);
    }

    /** @return число неуспешных задач */
    static int run(Config cfg, Args a) throws InterruptedException {
        CountDownLatch left = new CountDownLatch(a.inputs().size());
        List<QueueTask> tasks = new ArrayList<>();
        try (VideoDenoiser denoiser = new VideoDenoiser(cfg);
             DenoiseQueueService queue = new DenoiseQueueService(Duration.ofMillis(cfg.threads().timeoutMs()))) {
            queue.addListener(t -> {
                log.debug("Task {}", t);
                if (t.isFinished()) left.countDown();
            });
            for (Path in : a.inputs()) {
                tasks.add(queue.enqueue(in, a.out()));
            }
            queue.start((task, onProgress, token) -> {
                DenoiseResult r = denoiser.denoise(task.video, task.output, onProgress, token);
                log.info("Task #{} written {} ({} frames, {} ms)", task.id, r.output(), r.frames(), r.elapsedMs());
            });
            left.await();
        }
        int failed = 0;
        for (QueueTask t : tasks) {
            if (t.status != QueueTask.Status.DONE) {
                failed++;
                log.error("Task #{} {}: {} ({})", t.id, t.video, t.status, t.message);
            } else {
                log.info("Task #{} {}: done", t.id, t.video);
            }
        }
        return failed;
    }
}
