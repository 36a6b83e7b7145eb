package org.comicinfo.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "comicinfo")
@Getter
@Setter
public class ComicInfoProperties {
    private Http http = new Http();
    private Xml xml = new Xml();

    @Getter
    @Setter
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private String userAgent = "comicinfo-java";
    }

    @Getter
    @Setter
    public static class Xml {
        /**
         * Indent written ComicInfo.xml documents. Element text is never altered.
         */
        private boolean prettyPrint = true;
    }
}
