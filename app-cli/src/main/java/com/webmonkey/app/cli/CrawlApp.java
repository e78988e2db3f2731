package com.webmonkey.app.cli;

import com.webmonkey.app.logging.LogSetup;
import com.webmonkey.core.api.CrawlValidationException;
import com.webmonkey.core.crawler.Crawler;
import com.webmonkey.core.driver.DriverFactory;
import com.webmonkey.core.driver.PlaywrightBrowserDriver;
import com.webmonkey.core.export.CrawlSummaryExporter;
import com.webmonkey.core.export.FileOutputSink;
import com.webmonkey.core.model.CanonicalUrl;
import com.webmonkey.core.model.CrawlConfig;
import com.webmonkey.core.model.CrawlResult;
import com.webmonkey.core.util.ProgressListener;
import com.webmonkey.core.util.UrlCanonicalizer;
import com.webmonkey.core.util.YamlConfigLoader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 명령행 진입점.
 * crawl.yml(또는 -c 로 지정한 파일)을 읽고 옵션으로 덮어쓴 뒤 Playwright 로 크롤,
 * 페이지마다 FileOutputSink 로 저장하고 끝나면 요약 JSON 을 남긴다.
 */
public final class CrawlApp {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILED = 3;

    private CrawlApp() {}

    public static void main(String[] args) {
        System.exit(run(args, null));
    }

    /**
     * @param drivers null 이면 설정 기반 Playwright 드라이버
     * @return 종료 코드
     */
    static int run(String[] args, DriverFactory drivers) {
        Options options = options();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println("crawl: " + e.getMessage());
            printHelp(options);
            return EXIT_USAGE;
        }
        if (cmd.hasOption("h")) {
            printHelp(options);
            return EXIT_OK;
        }

        CrawlConfig cfg;
        try {
            cfg = toConfig(cmd);
        } catch (CrawlValidationException e) {
            System.err.println("crawl: invalid " + e.getField() + ": " + e.getMessage());
            return EXIT_INVALID;
        } catch (IOException | NumberFormatException e) {
            System.err.println("crawl: " + e.getMessage());
            printHelp(options);
            return EXIT_USAGE;
        }

        LogSetup.configure(cfg.getOutputDir());
        if (cmd.hasOption("log-level")) LogSetup.setLevel(LogSetup.levelOf(cmd.getOptionValue("log-level")));
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));

        DriverFactory df = (drivers != null ? drivers : PlaywrightBrowserDriver.factory(cfg.browser()));
        FileOutputSink sink = new FileOutputSink(cfg);
        Instant started = Instant.now();
        try (Crawler crawler = new Crawler(df)) {
            crawler.onPage(saveTo(sink));
            CrawlResult result = crawler.crawl(cfg);
            Path summary = new CrawlSummaryExporter().export(cfg.getOutputDir(), cfg, result, started);
            LOG.info("Crawl finished: pages={}, errors={}, summary={}",
                    result.size(), result.errorCount(), summary.toAbsolutePath());
            return EXIT_OK;
        } catch (CrawlValidationException e) {
            LOG.error("Invalid configuration ({}): {}", e.getField(), e.getMessage());
            return EXIT_INVALID;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Crawl interrupted");
            return EXIT_FAILED;
        } catch (Exception e) {
            LOG.error("Crawl failed: {}", e.toString(), e);
            return EXIT_FAILED;
        }
    }

    /** 설정 파일(있으면) + 명령행 덮어쓰기. 검증까지 마친 설정을 돌려준다. */
    static CrawlConfig toConfig(CommandLine cmd) throws IOException {
        CrawlConfig cfg;
        if (cmd.hasOption("config")) {
            cfg = YamlConfigLoader.read(Path.of(cmd.getOptionValue("config")));
        } else if (Files.exists(Path.of("crawl.yml"))) {
            cfg = YamlConfigLoader.read(Path.of("crawl.yml"));
        } else {
            cfg = CrawlConfig.defaults();
        }

        List<String> rest = cmd.getArgList();
        if (cmd.hasOption("url")) cfg.setTarget(cmd.getOptionValue("url"));
        else if (!rest.isEmpty()) cfg.setTarget(rest.get(0));

        if (cmd.hasOption("depth")) cfg.setMaxDepth(Integer.parseInt(cmd.getOptionValue("depth").trim()));
        if (cmd.hasOption("max-pages")) cfg.setMaxPages(Integer.parseInt(cmd.getOptionValue("max-pages").trim()));
        if (cmd.hasOption("rate")) cfg.setRateLimitSeconds(Double.parseDouble(cmd.getOptionValue("rate").trim()));
        if (cmd.hasOption("concurrency")) cfg.setConcurrency(Integer.parseInt(cmd.getOptionValue("concurrency").trim()));
        if (cmd.hasOption("formats")) {
            List<String> names = Arrays.stream(cmd.getOptionValue("formats").split(","))
                    .map(String::trim).filter(s -> !s.isEmpty()).collect(Collectors.toList());
            cfg.setOutputFormatNames(names);
        }
        if (cmd.hasOption("out")) cfg.setOutputDir(Path.of(cmd.getOptionValue("out")));
        if (cmd.hasOption("include")) cfg.setIncludePattern(cmd.getOptionValue("include"));
        if (cmd.hasOption("exclude")) cfg.setExcludePaths(Arrays.asList(cmd.getOptionValues("exclude")));
        if (cmd.hasOption("links-format")) cfg.setLinksFormat(linksFormat(cmd.getOptionValue("links-format")));
        if (cmd.hasOption("all-domains")) cfg.setSameDomainOnly(false);
        if (cmd.hasOption("subdomains")) cfg.setFollowSubdomains(true);
        if (cmd.hasOption("headed")) cfg.browser().setHeadless(false);

        cfg.validate();
        return cfg;
    }

    private static CrawlConfig.LinksFormat linksFormat(String v) {
        try {
            return CrawlConfig.LinksFormat.valueOf(v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CrawlValidationException("linksFormat", "expected txt or json, got: " + v, e);
        }
    }

    private static ProgressListener saveTo(FileOutputSink sink) {
        return (done, pending, page) -> {
            CanonicalUrl url = UrlCanonicalizer.canonicalize(page.getUrl());
            if (url == null || page.isError()) {
                LOG.info("[{}] {} failed: {} (pending {})", done, page.getUrl(), page.getError(), pending);
                return;
            }
            try {
                List<Path> files = sink.write(url, page);
                LOG.info("[{}] {} -> {} file(s) (pending {})", done, url, files.size(), pending);
            } catch (IOException e) {
                LOG.warn("Failed to save {}: {}", url, e.toString());
            }
        };
    }

    static Options options() {
        Options o = new Options();
        o.addOption(Option.builder("c").longOpt("config").argName("FILE").hasArg()
                .desc("crawl.yml path (default: ./crawl.yml if present)").build());
        o.addOption(Option.builder("u").longOpt("url").argName("URL").hasArg()
                .desc("seed URL (or first positional argument)").build());
        o.addOption(Option.builder("d").longOpt("depth").argName("N").hasArg()
                .desc("max link depth from the seed").build());
        o.addOption(Option.builder("p").longOpt("max-pages").argName("N").hasArg()
                .desc("stop admitting URLs after N pages (0 = unlimited)").build());
        o.addOption(Option.builder("r").longOpt("rate").argName("SECONDS").hasArg()
                .desc("minimum seconds between page fetches").build());
        o.addOption(Option.builder("n").longOpt("concurrency").argName("N").hasArg()
                .desc("parallel browser sessions").build());
        o.addOption(Option.builder("f").longOpt("formats").argName("LIST").hasArg()
                .desc("comma separated: markdown,json,html,rawHtml,links,screenshot,screenshot@fullPage").build());
        o.addOption(Option.builder("o").longOpt("out").argName("DIR").hasArg()
                .desc("output directory").build());
        o.addOption(Option.builder("i").longOpt("include").argName("REGEX").hasArg()
                .desc("only follow URLs matching this pattern").build());
        o.addOption(Option.builder("x").longOpt("exclude").argName("GLOB").hasArg()
                .desc("skip URL paths matching this glob (repeatable, 're:' prefix for regex)").build());
        o.addOption(Option.builder().longOpt("links-format").argName("txt|json").hasArg()
                .desc("file format for the links output").build());
        o.addOption(Option.builder().longOpt("all-domains").desc("follow links to other hosts").build());
        o.addOption(Option.builder().longOpt("subdomains").desc("follow subdomains of the seed host").build());
        o.addOption(Option.builder().longOpt("headed").desc("show the browser window").build());
        o.addOption(Option.builder().longOpt("log-level").argName("LEVEL").hasArg()
                .desc("FINE|INFO|WARNING|SEVERE (or DEBUG/WARN/ERROR)").build());
        o.addOption("h", "help", false, "print this help");
        return o;
    }

    private static void printHelp(Options options) {
        new HelpFormatter().printHelp("crawl [options] [seed-url]", options);
    }
}
