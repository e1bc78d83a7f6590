package com.example.campusevents.config;

import com.example.campusevents.security.JwtAuthenticationFilter;
import com.example.campusevents.security.JwtTokenProvider;
import com.example.campusevents.service.AppUserService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.authentication.dao.DaoAuthenticationProvider;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
public class SecurityConfig {

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * AppUserService and the encoder come in as method parameters so SecurityConfig does not
     * depend on AppUserService at construction time (it needs the encoder bean from here).
     */
    @Bean
    public DaoAuthenticationProvider authProvider(AppUserService appUserService, PasswordEncoder passwordEncoder) {
        DaoAuthenticationProvider provider = new DaoAuthenticationProvider();
        provider.setUserDetailsService(appUserService);
        provider.setPasswordEncoder(passwordEncoder);
        return provider;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http,
                                           DaoAuthenticationProvider authProvider,
                                           JwtTokenProvider tokenProvider,
                                           AppUserService appUserService,
                                           ObjectMapper objectMapper) throws Exception {
        JsonSecurityErrorHandler errorHandler = new JsonSecurityErrorHandler(objectMapper);
        http
                .csrf(AbstractHttpConfigurer::disable)
                .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/api/auth/register", "/api/auth/login", "/uploads/**", "/error").permitAll()
                        .requestMatchers("/api/admin/**", "/api/onduty/admin/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.POST, "/api/events/*/register").hasRole("STUDENT")
                        .requestMatchers(HttpMethod.GET, "/api/events/*/participants").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.POST, "/api/events").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.PUT, "/api/events/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.DELETE, "/api/events/**").hasRole("ADMIN")
                        .requestMatchers("/api/attendance/checkin", "/api/attendance/upload-photo").hasRole("STUDENT")
                        .requestMatchers("/api/attendance/event/**", "/api/attendance/participant/**").hasRole("ADMIN")
                        .requestMatchers("/api/onduty/**").hasRole("STUDENT")
                        .requestMatchers(HttpMethod.POST, "/api/certificates/upload").hasRole("STUDENT")
                        .requestMatchers(HttpMethod.POST, "/api/certificates/generate").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.PUT, "/api/certificates/*/status").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.GET, "/api/certificates").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.DELETE, "/api/students/*").hasRole("ADMIN")
                        .anyRequest().authenticated()
                )
                .exceptionHandling(e -> e
                        .authenticationEntryPoint(errorHandler)
                        .accessDeniedHandler(errorHandler)
                )
                .authenticationProvider(authProvider)
                .addFilterBefore(new JwtAuthenticationFilter(tokenProvider, appUserService),
                        UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
