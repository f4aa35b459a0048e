package org.smileyface.linkarchive;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.linkarchive.cli.ArchiveCliRunner;
import org.smileyface.linkarchive.config.ArchiverProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ArchiverProperties.class)
public class LinkArchiverApplication {

    private static final Logger log = LogManager.getLogger();

    public static void main(String[] args) {
        try {
            SpringApplication.run(LinkArchiverApplication.class, args);
        } catch (RuntimeException e) {
            int code = ArchiveCliRunner.exitCodeFor(e);
            log.error("Link archiver could not start (exit code {}): {}", code, ArchiveCliRunner.rootMessage(e));
            System.exit(code);
        }
    }
}
