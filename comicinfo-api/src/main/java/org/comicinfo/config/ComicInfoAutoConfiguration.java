package org.comicinfo.config;

import org.comicinfo.service.ComicInfoJsonCodec;
import org.comicinfo.service.ComicInfoLoader;
import org.comicinfo.service.parser.ComicInfoParser;
import org.comicinfo.service.writer.ComicInfoXmlWriter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.net.http.HttpClient;

@AutoConfiguration
@EnableConfigurationProperties(ComicInfoProperties.class)
public class ComicInfoAutoConfiguration {

    public static final String COMIC_INFO_HTTP_CLIENT = "comicInfoHttpClient";

    @Bean(name = COMIC_INFO_HTTP_CLIENT)
    @ConditionalOnMissingBean(name = COMIC_INFO_HTTP_CLIENT)
    public HttpClient comicInfoHttpClient(ComicInfoProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getHttp().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ComicInfoParser comicInfoParser() {
        return new ComicInfoParser();
    }

    @Bean
    @ConditionalOnMissingBean
    public ComicInfoLoader comicInfoLoader(ComicInfoParser comicInfoParser,
                                           @Qualifier(COMIC_INFO_HTTP_CLIENT) HttpClient httpClient,
                                           ComicInfoProperties properties) {
        return new ComicInfoLoader(comicInfoParser, httpClient, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ComicInfoXmlWriter comicInfoXmlWriter(ComicInfoProperties properties) {
        return new ComicInfoXmlWriter(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ComicInfoJsonCodec comicInfoJsonCodec() {
        return new ComicInfoJsonCodec();
    }
}
