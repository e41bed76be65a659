package com.agentscan.scoring;

import com.agentscan.model.BusinessModel;
import com.agentscan.model.HtmlSignals;
import com.agentscan.model.SignalBundle;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Picks a merchant's business model from its signals.
 *
 * <p>Precedence, first applicable wins: explicit merchant category, commerce platform, product
 * structured data, HTML hints, then {@link BusinessModel#RETAIL}.
 */
@Component
public class BusinessModelClassifier {

    private static final Map<String, BusinessModel> CATEGORY_MODELS = Map.of(
            "saas", BusinessModel.SAAS,
            "retail", BusinessModel.RETAIL,
            "restaurant", BusinessModel.RETAIL
    );

    private static final Map<String, BusinessModel> PLATFORM_MODELS = Map.of(
            "shopify", BusinessModel.RETAIL,
            "woocommerce", BusinessModel.RETAIL,
            "etsy", BusinessModel.MARKETPLACE
    );

    public BusinessModel classify(SignalBundle signals) {
        if (signals == null) {
            return BusinessModel.RETAIL;
        }

        BusinessModel byCategory = CATEGORY_MODELS.get(key(signals.getMerchantCategory()));
        if (byCategory != null) {
            return byCategory;
        }

        BusinessModel byPlatform = PLATFORM_MODELS.get(key(signals.getEcommercePlatform()));
        if (byPlatform != null) {
            return byPlatform;
        }

        if (signals.isHasSchemaProduct() && signals.isHasSchemaOffer() && signals.getProductCount() > 0) {
            return BusinessModel.RETAIL;
        }

        HtmlSignals html = signals.getHtmlSignals();
        if (html.isHasApiDocs() && html.isHasPricingPage()) {
            return BusinessModel.API_PROVIDER;
        }
        if (html.isHasPricingPage() && html.isHasSignup()) {
            return BusinessModel.SAAS;
        }

        return BusinessModel.RETAIL;
    }

    private static String key(String v) {
        return v == null ? "" : v.trim().toLowerCase(Locale.ROOT);
    }
}
