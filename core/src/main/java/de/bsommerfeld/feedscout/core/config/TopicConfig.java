package de.bsommerfeld.feedscout.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Category to hashtag presets used by trend runs. The {@value #GENERIC_KEY}
 * entry is the fallback for categories without a preset.
 */
public class TopicConfig {

    public static final String GENERIC_KEY = "_generic";

    /** Hashtags scanned per business category. */
    @JsonProperty("hashtags")
    private Map<String, List<String>> hashtags = defaults();

    public Map<String, List<String>> getHashtags() {
        return hashtags;
    }

    public void setHashtags(Map<String, List<String>> hashtags) {
        this.hashtags = hashtags;
    }

    private static Map<String, List<String>> defaults() {
        Map<String, List<String>> presets = new LinkedHashMap<>();
        // Food & beverage
        presets.put("restaurant", List.of("restaurant", "foodie", "foodreels", "viralfood", "streetfood",
                "foodlover", "fypfood", "foodvibes", "cheesepull", "dinnerdate", "lunchideas", "foodporn",
                "forkyeah"));
        presets.put("burger", List.of("burgerlover", "burgertime", "burgerreels", "smashburger", "cheeseburger",
                "burgersoftiktok", "burgersofinstagram"));
        presets.put("pizza", List.of("pizzatime", "pizzanight", "pizzareels", "pizzalover", "pizzalovers",
                "pizzalove"));
        presets.put("cafe", List.of("coffee", "coffeereels", "coffeetime", "coffeelover", "latteart",
                "coffeeshop", "coffeebar", "coffeebreak"));
        presets.put("bakery", List.of("bakery", "bakerylove", "croissant", "pastry", "dessertreels",
                "sweettreats", "chocolatelover", "dessertlover"));
        presets.put("bar", List.of("cocktails", "cocktailreels", "mixology", "bartenderlife", "nightout",
                "happyhour", "drinkswithfriends"));
        // Fitness & wellness
        presets.put("gym", List.of("gym", "gymreels", "fitness", "workout", "fitreels", "gymmotivation",
                "gymlife", "legday", "pushpulllegs", "hypertrophy"));
        presets.put("personal_trainer", List.of("personaltrainer", "ptlife", "onlinetraining", "onlinecoach",
                "fitnessmotivation", "homeworkout"));
        presets.put("yoga", List.of("yoga", "yogareels", "yogapractice", "yogainspiration", "yogaflow",
                "mindfulness"));
        // Beauty & clinics
        presets.put("beauty_salon", List.of("hairreels", "hairtransformation", "hairgoals", "salonreels",
                "nailart", "nailsreels", "beautysalon"));
        presets.put("clinic", List.of("skincareclinic", "dermatology", "aestheticclinic", "beforeandafter",
                "skinreels", "facialtreatment"));
        presets.put("dentist", List.of("dentalreels", "smilemakeover", "teethwhitening", "dentist",
                "dentalclinic", "beforeandafter"));
        // Hospitality
        presets.put("hotel", List.of("hotelreels", "hotellife", "staycation", "luxuryhotel", "boutiquehotel",
                "hotelview"));
        presets.put("resort", List.of("beachresort", "poolday", "resortlife", "vacationvibes", "summerreels"));
        presets.put("party", List.of("partyreels", "nightlife", "clubreels", "djlife", "festivalseason"));
        // Retail
        presets.put("supermarket", List.of("groceryhaul", "supermarket", "shoppingreels", "groceryshopping",
                "budgetshopping"));
        presets.put("fashion_store", List.of("outfitinspo", "ootdreels", "fashionreels", "tryonhaul",
                "streetstyle"));
        presets.put(GENERIC_KEY, List.of("trending", "viral", "explorepage", "reels", "fyp"));
        return presets;
    }
}
