package ru.uzden.vpnpanel.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import ru.uzden.vpnpanel.controllers.AdminTokenInterceptor;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final PanelProperties props;

    public WebConfig(PanelProperties props) {
        this.props = props;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AdminTokenInterceptor(props.admin().token()))
                .addPathPatterns("/api/admin/**");
    }
}
