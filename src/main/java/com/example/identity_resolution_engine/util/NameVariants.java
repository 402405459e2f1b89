package com.example.identity_resolution_engine.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 名字变体表：正式名 -> 昵称，以及反向索引。
 * 进程级只读常量，类加载时初始化一次，可在多线程间共享。
 */
public final class NameVariants {

    private static final Map<String, List<String>> FORMAL_TO_NICKNAMES;
    private static final Map<String, List<String>> NICKNAME_TO_FORMALS;

    static {
        Map<String, List<String>> table = new LinkedHashMap<>();
        // 常见英文名
        put(table, "robert", "bob", "rob", "robbie", "bobby", "bert");
        put(table, "william", "bill", "will", "billy", "willy", "liam");
        put(table, "richard", "rick", "dick", "rich", "ricky");
        put(table, "james", "jim", "jimmy", "jamie");
        put(table, "john", "jack", "johnny", "jon");
        put(table, "michael", "mike", "mick", "mickey", "mikey");
        put(table, "joseph", "joe", "joey");
        put(table, "thomas", "tom", "tommy");
        put(table, "charles", "charlie", "chuck", "chas");
        put(table, "david", "dave", "davy");
        put(table, "daniel", "dan", "danny");
        put(table, "edward", "ed", "eddie", "ted", "teddy", "ned");
        put(table, "steven", "steve", "stevie");
        put(table, "stephen", "steve", "stevie");
        put(table, "christopher", "chris", "kit");
        put(table, "matthew", "matt", "matty");
        put(table, "anthony", "tony", "ant");
        put(table, "andrew", "andy", "drew");
        put(table, "nicholas", "nick", "nicky");
        put(table, "benjamin", "ben", "benny", "benji");
        put(table, "samuel", "sam", "sammy");
        put(table, "alexander", "alex", "al", "xander");
        put(table, "jonathan", "jon", "jonny", "nathan");
        put(table, "timothy", "tim", "timmy");
        put(table, "gregory", "greg", "gregg");
        put(table, "patrick", "pat", "paddy");
        put(table, "raymond", "ray");
        put(table, "lawrence", "larry", "laurie");
        put(table, "gerald", "gerry", "jerry");
        put(table, "kenneth", "ken", "kenny");
        put(table, "ronald", "ron", "ronny");
        put(table, "donald", "don", "donny");
        put(table, "phillip", "phil");
        put(table, "philip", "phil");
        put(table, "eugene", "gene");
        put(table, "walter", "walt", "wally");
        put(table, "frederick", "fred", "freddy", "freddie");
        put(table, "albert", "al", "bert", "bertie");
        put(table, "arthur", "art", "artie");
        put(table, "henry", "hank", "harry", "hal");
        put(table, "harold", "harry", "hal");
        put(table, "peter", "pete");
        put(table, "douglas", "doug", "dougie");
        put(table, "leonard", "leo", "len", "lenny");
        put(table, "theodore", "ted", "teddy", "theo");
        put(table, "francis", "frank", "frankie", "fran");
        put(table, "bernard", "bernie", "barney");
        put(table, "louis", "lou", "louie");
        put(table, "vincent", "vince", "vinny", "vin");
        put(table, "nathaniel", "nate", "nat", "nathan");
        put(table, "elizabeth", "liz", "lizzy", "beth", "betty", "betsy", "eliza", "lisa");
        put(table, "margaret", "maggie", "meg", "peggy", "peg", "marge", "margie");
        put(table, "katherine", "kathy", "kate", "katie", "kat");
        put(table, "catherine", "cathy", "kate", "katie", "cat");
        put(table, "patricia", "pat", "patty", "tricia", "trish");
        put(table, "jennifer", "jen", "jenny", "jenn");
        put(table, "rebecca", "becky", "becca");
        put(table, "deborah", "deb", "debbie");
        put(table, "susan", "sue", "susie", "suzy");
        put(table, "dorothy", "dot", "dotty", "dottie");
        put(table, "victoria", "vicky", "vicki", "vic", "tori");
        put(table, "christine", "chris", "chrissy", "tina");
        put(table, "christina", "chris", "chrissy", "tina");
        put(table, "alexandra", "alex", "lexi", "sandra");
        put(table, "samantha", "sam", "sammy");
        put(table, "jessica", "jess", "jessie");
        put(table, "stephanie", "steph", "stephie");
        put(table, "melissa", "mel", "missy", "lissa");
        put(table, "jacqueline", "jackie", "jacqui");
        put(table, "carolyn", "carol", "carrie", "lyn");
        put(table, "caroline", "carol", "carrie", "line");
        put(table, "abigail", "abby", "gail");
        put(table, "madeleine", "maddie", "maddy");
        put(table, "madeline", "maddie", "maddy");
        put(table, "josephine", "jo", "josie");
        put(table, "gabrielle", "gabby", "gabi", "elle");
        put(table, "gabriella", "gabby", "gabi", "ella");
        put(table, "natalie", "nat", "natty");
        put(table, "sarah", "sally");
        put(table, "nicole", "nicky", "nikki");
        // 俄语及其他语种变体
        put(table, "alexander", "sasha");
        put(table, "mikhail", "misha", "michael");
        put(table, "aleksandr", "sasha", "alex", "alexander");
        put(table, "yevgeny", "eugene", "zhenya");
        put(table, "dmitri", "dima", "dmitry");
        put(table, "nikolai", "kolya", "nicholas");
        put(table, "sergei", "seryozha");
        put(table, "vladimir", "volodya", "vlad");
        put(table, "giuseppe", "joe", "joseph");
        put(table, "giovanni", "john", "gianni");
        put(table, "francesco", "frank", "francis");
        put(table, "antonio", "tony", "anthony");
        put(table, "johannes", "john", "hans", "johan");
        put(table, "wilhelm", "william", "willi");
        put(table, "friedrich", "frederick", "fritz");
        put(table, "heinrich", "henry", "heinz");
        put(table, "karl", "charles", "carl");

        Map<String, List<String>> reverse = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : table.entrySet()) {
            for (String nickname : entry.getValue()) {
                reverse.computeIfAbsent(nickname, k -> new ArrayList<>()).add(entry.getKey());
            }
        }

        Map<String, List<String>> frozen = new LinkedHashMap<>();
        table.forEach((k, v) -> frozen.put(k, Collections.unmodifiableList(v)));
        FORMAL_TO_NICKNAMES = Collections.unmodifiableMap(frozen);

        Map<String, List<String>> frozenReverse = new LinkedHashMap<>();
        reverse.forEach((k, v) -> frozenReverse.put(k, Collections.unmodifiableList(v)));
        NICKNAME_TO_FORMALS = Collections.unmodifiableMap(frozenReverse);
    }

    private NameVariants() {
    }

    // 同一正式名多次登记时合并昵称列表
    private static void put(Map<String, List<String>> table, String formal, String... nicknames) {
        List<String> list = table.computeIfAbsent(formal, k -> new ArrayList<>());
        for (String nickname : nicknames) {
            if (!list.contains(nickname)) {
                list.add(nickname);
            }
        }
    }

    /**
     * 返回名字的所有已知变体（包含自身）。
     * 昵称会经由其正式名扩展出兄弟昵称，例如 bob 与 rob 都经 robert 关联。
     */
    public static Set<String> variantsOf(String firstName) {
        if (firstName == null || firstName.trim().isEmpty()) {
            return Collections.emptySet();
        }
        String normalized = firstName.toLowerCase().trim();
        Set<String> variants = new LinkedHashSet<>();
        variants.add(normalized);

        List<String> nicknames = FORMAL_TO_NICKNAMES.get(normalized);
        if (nicknames != null) {
            variants.addAll(nicknames);
        }

        List<String> formals = NICKNAME_TO_FORMALS.get(normalized);
        if (formals != null) {
            for (String formal : formals) {
                variants.add(formal);
                List<String> siblings = FORMAL_TO_NICKNAMES.get(formal);
                if (siblings != null) {
                    variants.addAll(siblings);
                }
            }
        }
        return variants;
    }

    public static boolean areVariants(String a, String b) {
        if (a == null || b == null || a.trim().isEmpty() || b.trim().isEmpty()) {
            return false;
        }
        String n1 = a.toLowerCase().trim();
        String n2 = b.toLowerCase().trim();
        if (n1.equals(n2)) {
            return true;
        }
        return variantsOf(n1).contains(n2);
    }

    /**
     * 昵称对应的第一个正式名，不是已知昵称时返回null。
     * 本身就是正式名的（john、william、michael）不改写，避免换成另一个人的名字。
     */
    public static String formalNameOf(String nickname) {
        if (nickname == null) {
            return null;
        }
        String normalized = nickname.toLowerCase().trim();
        if (FORMAL_TO_NICKNAMES.containsKey(normalized)) {
            return null;
        }
        List<String> formals = NICKNAME_TO_FORMALS.get(normalized);
        return formals == null || formals.isEmpty() ? null : formals.get(0);
    }

    public static Set<String> formalNames() {
        return FORMAL_TO_NICKNAMES.keySet();
    }

    public static List<String> nicknamesOf(String formal) {
        List<String> list = FORMAL_TO_NICKNAMES.get(formal);
        return list == null ? Collections.emptyList() : list;
    }
}
