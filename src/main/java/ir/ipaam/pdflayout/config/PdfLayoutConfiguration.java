package ir.ipaam.pdflayout.config;

import ir.ipaam.pdflayout.domain.font.FontMetricsProvider;
import ir.ipaam.pdflayout.domain.font.StandardFontMetricsProvider;
import ir.ipaam.pdflayout.domain.theme.TextStyle;
import ir.ipaam.pdflayout.domain.theme.ThemeData;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PdfLayoutProperties.class)
public class PdfLayoutConfiguration {

    @Bean
    public FontMetricsProvider fontMetricsProvider() {
        return new StandardFontMetricsProvider();
    }

    @Bean
    public ThemeData themeData(PdfLayoutProperties properties) {
        return ThemeData.defaults().withDefaultTextStyle(TextStyle.builder()
                .fontFamily(properties.getDefaultFontFamily())
                .fontSize(properties.getDefaultFontSize())
                .build());
    }
}
